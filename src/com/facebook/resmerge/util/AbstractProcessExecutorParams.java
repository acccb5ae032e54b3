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

import com.facebook.resmerge.core.util.immutables.ResMergeStyleImmutable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/** Parameters used to launch a process with a {@link ProcessExecutor}. */
@Value.Immutable
@ResMergeStyleImmutable
abstract class AbstractProcessExecutorParams {

  /** The command and arguments to launch. */
  public abstract ImmutableList<String> getCommand();

  /** If present, the current working directory for the launched process. */
  public abstract Optional<Path> getDirectory();

  /** If not empty, replaces the environment variables of the launched process. */
  public abstract ImmutableMap<String, String> getEnvironment();

  public static ProcessExecutorParams ofCommand(String... args) {
    return ProcessExecutorParams.builder().addCommand(args).build();
  }
}
