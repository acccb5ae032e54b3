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

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;

/** Thrown by the {@link DefaultStepRunner} when a step does not exit successfully. */
public class StepFailedException extends Exception {

  private final Step step;
  private final int exitCode;

  private StepFailedException(String message, Step step, int exitCode) {
    super(message);
    this.step = step;
    this.exitCode = exitCode;
  }

  private StepFailedException(Throwable cause, String message, Step step) {
    super(message, cause);
    this.step = step;
    this.exitCode = StepExecutionResults.ERROR_EXIT_CODE;
  }

  public static StepFailedException createForFailingStepWithExitCode(
      Step step, ExecutionContext context, StepExecutionResult executionResult) {
    List<String> lines = new ArrayList<>();
    lines.add(
        String.format(
            "Command failed with exit code %d.", executionResult.getExitCode()));
    lines.add("command: " + step.getDescription(context));
    executionResult
        .getStderr()
        .filter(stderr -> !stderr.isEmpty())
        .ifPresent(stderr -> lines.add("stderr: " + stderr));
    return new StepFailedException(
        Joiner.on(System.lineSeparator()).join(lines), step, executionResult.getExitCode());
  }

  public static StepFailedException createForFailingStepWithException(
      Step step, ExecutionContext context, Throwable throwable) {
    return new StepFailedException(
        throwable,
        String.format(
            "Step %s failed: %s%s  %s",
            step.getShortName(),
            throwable.getMessage(),
            System.lineSeparator(),
            step.getDescription(context)),
        step);
  }

  public Step getStep() {
    return step;
  }

  public int getExitCode() {
    return exitCode;
  }
}
