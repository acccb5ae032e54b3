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

/** Losslessly converts one PNG to WebP with {@code cwebp}. */
public class WebpConversionStep extends ShellStep {

  private final Path cwebp;
  private final Path png;
  private final Path webp;

  /** All paths are absolute. */
  public WebpConversionStep(Path cwebp, Path png, Path webp) {
    this.cwebp = cwebp;
    this.png = png;
    this.webp = webp;
  }

  @Override
  public String getShortName() {
    return "cwebp";
  }

  @Override
  protected ImmutableList<String> getShellCommandInternal(ExecutionContext context) {
    return ImmutableList.of(
        cwebp.toString(),
        png.toString(),
        "-mt",
        "-quiet",
        "-m",
        "6",
        "-q",
        "100",
        "-lossless",
        "-o",
        webp.toString());
  }

  public Path getPng() {
    return png;
  }

  public Path getWebp() {
    return webp;
  }
}
