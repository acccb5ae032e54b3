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

package com.facebook.resmerge.util;

import com.google.common.base.MoreObjects;
import java.io.IOException;
import java.util.Optional;

/** Launches external processes and collects their output. */
public interface ProcessExecutor {

  /** Launches the process described by {@code params} and waits for it to exit. */
  Result launchAndExecute(ProcessExecutorParams params) throws IOException, InterruptedException;

  /** Values from the result of {@link ProcessExecutor#launchAndExecute}. */
  class Result {

    private final int exitCode;
    private final Optional<String> stdout;
    private final Optional<String> stderr;

    public Result(int exitCode, String stdout, String stderr) {
      this.exitCode = exitCode;
      this.stdout = Optional.of(stdout);
      this.stderr = Optional.of(stderr);
    }

    public int getExitCode() {
      return exitCode;
    }

    public Optional<String> getStdout() {
      return stdout;
    }

    public Optional<String> getStderr() {
      return stderr;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("exitCode", exitCode)
          .add("stdout", stdout)
          .add("stderr", stderr)
          .toString();
    }
  }
}
