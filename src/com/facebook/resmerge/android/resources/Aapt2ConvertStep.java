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

/** Converts a proto-format resource package to the binary format. */
public class Aapt2ConvertStep extends ShellStep {

  private final Path aapt2;
  private final Path protoPackage;
  private final Path arscPackage;

  public Aapt2ConvertStep(Path aapt2, Path protoPackage, Path arscPackage) {
    this.aapt2 = aapt2;
    this.protoPackage = protoPackage;
    this.arscPackage = arscPackage;
  }

  @Override
  public String getShortName() {
    return "aapt2_convert";
  }

  @Override
  protected ImmutableList<String> getShellCommandInternal(ExecutionContext context) {
    return ImmutableList.of(
        aapt2.toString(), "convert", "-o", arscPackage.toString(), protoPackage.toString());
  }
}
