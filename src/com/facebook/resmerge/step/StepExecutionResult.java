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

package com.facebook.resmerge.step;

import com.google.common.base.MoreObjects;
import java.util.Optional;

/** Exit code, and optionally the standard error, of an executed {@link Step}. */
public class StepExecutionResult {

  private final int exitCode;
  private final Optional<String> stderr;

  private StepExecutionResult(int exitCode, Optional<String> stderr) {
    this.exitCode = exitCode;
    this.stderr = stderr;
  }

  public static StepExecutionResult of(int exitCode) {
    return new StepExecutionResult(exitCode, Optional.empty());
  }

  public static StepExecutionResult of(int exitCode, Optional<String> stderr) {
    return new StepExecutionResult(exitCode, stderr);
  }

  public int getExitCode() {
    return exitCode;
  }

  public Optional<String> getStderr() {
    return stderr;
  }

  public boolean isSuccess() {
    return exitCode == StepExecutionResults.SUCCESS_EXIT_CODE;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("exitCode", exitCode)
        .add("stderr", stderr)
        .toString();
  }
}
