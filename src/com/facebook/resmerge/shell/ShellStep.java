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

package com.facebook.resmerge.shell;

import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.step.ExecutionContext;
import com.facebook.resmerge.step.Step;
import com.facebook.resmerge.step.StepExecutionResult;
import com.facebook.resmerge.util.ProcessExecutor;
import com.facebook.resmerge.util.ProcessExecutorParams;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** A {@link Step} that launches an external command and reports its exit code. */
public abstract class ShellStep implements Step {

  private static final Logger LOG = Logger.get(ShellStep.class);

  /** Defined lazily by {@link #getShellCommand(ExecutionContext)}. */
  @Nullable private ImmutableList<String> shellCommandArgs;

  private final Optional<Path> workingDirectory;

  @Nullable private String stdout;
  @Nullable private String stderr;

  protected ShellStep(Optional<Path> workingDirectory) {
    this.workingDirectory = workingDirectory;
  }

  protected ShellStep() {
    this(Optional.empty());
  }

  @Override
  public StepExecutionResult execute(ExecutionContext context)
      throws IOException, InterruptedException {
    ProcessExecutorParams params =
        ProcessExecutorParams.builder()
            .setCommand(getShellCommand(context))
            .setDirectory(workingDirectory)
            .setEnvironment(context.getEnvironment())
            .build();
    ProcessExecutor.Result result = context.getProcessExecutor().launchAndExecute(params);
    stdout = result.getStdout().orElse("");
    stderr = filterStderr(result.getStderr().orElse(""));

    if (!stdout.isEmpty()) {
      LOG.verbose("%s stdout:%n%s", getShortName(), stdout);
    }
    if (!stderr.isEmpty()) {
      LOG.debug("%s stderr:%n%s", getShortName(), stderr);
    }
    return StepExecutionResult.of(result.getExitCode(), Optional.of(stderr));
  }

  /**
   * Drops the stderr lines matching {@link #getIgnoredStderrPattern()}. Dropped lines never change
   * how the exit code is handled; they only disappear from diagnostics.
   */
  private String filterStderr(String rawStderr) {
    Optional<Pattern> ignored = getIgnoredStderrPattern();
    if (!ignored.isPresent() || rawStderr.isEmpty()) {
      return rawStderr;
    }
    ImmutableList.Builder<String> kept = ImmutableList.builder();
    for (String line : Splitter.on('\n').split(rawStderr)) {
      if (ignored.get().matcher(line).find()) {
        LOG.verbose("%s: ignoring informational output: %s", getShortName(), line);
      } else {
        kept.add(line);
      }
    }
    return Joiner.on('\n').join(kept.build()).trim();
  }

  public final ImmutableList<String> getShellCommand(ExecutionContext context) {
    if (shellCommandArgs == null) {
      shellCommandArgs = getShellCommandInternal(context);
    }
    return shellCommandArgs;
  }

  protected abstract ImmutableList<String> getShellCommandInternal(ExecutionContext context);

  /** Pattern of stderr lines that are informational for this tool. Empty by default. */
  protected Optional<Pattern> getIgnoredStderrPattern() {
    return Optional.empty();
  }

  @Override
  public String getDescription(ExecutionContext context) {
    return Joiner.on(' ').join(getShellCommand(context));
  }

  /** @return the stdout of the last execution, or {@code null} if it has not run yet. */
  @Nullable
  public String getStdout() {
    return stdout;
  }

  /** @return the filtered stderr of the last execution, or {@code null} if it has not run yet. */
  @Nullable
  public String getStderr() {
    return stderr;
  }
}
