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

import com.facebook.resmerge.core.util.immutables.ResMergeStyleImmutable;
import com.facebook.resmerge.util.ProcessExecutor;
import com.google.common.collect.ImmutableMap;
import java.io.PrintStream;
import org.immutables.value.Value;

/** Everything a {@link Step} may need from its environment while it executes. */
@Value.Immutable
@ResMergeStyleImmutable
abstract class AbstractExecutionContext {

  public abstract ProcessExecutor getProcessExecutor();

  /** Environment passed to every external process. */
  @Value.Default
  public ImmutableMap<String, String> getEnvironment() {
    return ImmutableMap.copyOf(System.getenv());
  }

  @Value.Default
  public PrintStream getStdErr() {
    return System.err;
  }

  /** Number of threads used by the parallel phases of a run. */
  @Value.Default
  public int getConcurrencyLimit() {
    return 10;
  }

  @Value.Check
  protected void check() {
    if (getConcurrencyLimit() < 1) {
      throw new IllegalArgumentException(
          "Concurrency limit must be positive: " + getConcurrencyLimit());
    }
  }
}
