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
import java.util.regex.Pattern;

/** Compiles one resource directory into a partial with {@code aapt2 compile}. */
public class Aapt2CompileStep extends ShellStep {

  /**
   * Some resources target API levels below the min SDK version. aapt2 ignores them, which is easier
   * than removing them from third-party libraries.
   */
  static final Pattern IGNORED_CONFIGURATION_WARNING =
      Pattern.compile("ignoring configuration .* for (styleable|attribute)");

  private final Path aapt2;
  private final Path resourceDirectory;
  private final Path partial;

  public Aapt2CompileStep(Path aapt2, Path resourceDirectory, Path partial) {
    this.aapt2 = aapt2;
    this.resourceDirectory = resourceDirectory;
    this.partial = partial;
  }

  @Override
  public String getShortName() {
    return "aapt2_compile";
  }

  @Override
  protected ImmutableList<String> getShellCommandInternal(ExecutionContext context) {
    return ImmutableList.of(
        aapt2.toString(),
        "compile",
        "--dir",
        resourceDirectory.toString(),
        "-o",
        partial.toString());
  }

  @Override
  protected Optional<Pattern> getIgnoredStderrPattern() {
    return Optional.of(IGNORED_CONFIGURATION_WARNING);
  }

  public Path getPartial() {
    return partial;
  }
}
