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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Runs {@code aapt2 dump resources} to find out which package ID a resource package uses. */
public class Aapt2DumpResourcesStep extends ShellStep {

  private static final Pattern PACKAGE_LINE =
      Pattern.compile("^\\s*Package name=(\\S+) id=([0-9a-fA-F]+)", Pattern.MULTILINE);

  private final Path aapt2;
  private final Path resourcePackage;

  public Aapt2DumpResourcesStep(Path aapt2, Path resourcePackage) {
    this.aapt2 = aapt2;
    this.resourcePackage = resourcePackage;
  }

  @Override
  public String getShortName() {
    return "aapt2_dump_resources";
  }

  @Override
  protected ImmutableList<String> getShellCommandInternal(ExecutionContext context) {
    return ImmutableList.of(aapt2.toString(), "dump", "resources", resourcePackage.toString());
  }

  /** The ID of the first package in the dump. Must only be called after a successful run. */
  public Optional<Integer> getPackageId() {
    String stdout = getStdout();
    Preconditions.checkState(stdout != null, "%s has not run", getShortName());
    return parsePackageId(stdout);
  }

  static Optional<Integer> parsePackageId(String dump) {
    Matcher matcher = PACKAGE_LINE.matcher(dump);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(Integer.parseInt(matcher.group(2), 16));
  }
}
