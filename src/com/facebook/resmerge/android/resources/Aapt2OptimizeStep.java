/*
 * Copyright 2019-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.resmerge.android.resources;

import com.facebook.resmerge.shell.ShellStep;
import com.facebook.resmerge.step.ExecutionContext;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Optional;

/** Runs {@code aapt2 optimize} on a linked resource package. */
public class Aapt2OptimizeStep extends ShellStep {

  private final Path aapt2;
  private final Path input;
  private final Path output;
  private final Optional<Path> obfuscationConfig;
  private final boolean shortenPaths;
  private final Optional<Path> pathShorteningMap;

  /**
   * @param obfuscationConfig if present, resource names are obfuscated except those this config
   *     lists as {@code #no_obfuscate}.
   */
  public Aapt2OptimizeStep(
      Path aapt2,
      Path input,
      Path output,
      Optional<Path> obfuscationConfig,
      boolean shortenPaths,
      Optional<Path> pathShorteningMap) {
    this.aapt2 = aapt2;
    this.input = input;
    this.output = output;
    this.obfuscationConfig = obfuscationConfig;
    this.shortenPaths = shortenPaths;
    this.pathShorteningMap = pathShorteningMap;
  }

  @Override
  public String getShortName() {
    return "aapt2_optimize";
  }

  @Override
  protected ImmutableList<String> getShellCommandInternal(ExecutionContext context) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    builder.add(aapt2.toString(), "optimize", input.toString(), "-o", output.toString());

    if (obfuscationConfig.isPresent()) {
      builder.add("--enable-resource-obfuscation");
      builder.add("--resources-config-path", obfuscationConfig.get().toString());
    }

    if (shortenPaths) {
      builder.add("--enable-resource-path-shortening");
    }

    if (pathShorteningMap.isPresent()) {
      builder.add("--resource-path-shortening-map", pathShorteningMap.get().toString());
    }

    return builder.build();
  }
}
