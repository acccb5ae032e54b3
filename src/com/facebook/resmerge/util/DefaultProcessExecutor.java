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

import com.facebook.resmerge.core.util.log.Logger;
import com.google.common.base.Joiner;
import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;

/** {@link ProcessExecutor} backed by {@link ProcessBuilder}. */
public class DefaultProcessExecutor implements ProcessExecutor {

  private static final Logger LOG = Logger.get(DefaultProcessExecutor.class);

  private static final Executor STDERR_READERS =
      Executors.newCachedThreadPool(
          new ThreadFactoryBuilder().setNameFormat("resmerge-stderr-%d").setDaemon(true).build());

  private final Executor stderrReader;

  public DefaultProcessExecutor() {
    this(STDERR_READERS);
  }

  /** @param stderrReader runs the blocking read of each child's stderr. */
  public DefaultProcessExecutor(Executor stderrReader) {
    this.stderrReader = stderrReader;
  }

  @Override
  public Result launchAndExecute(ProcessExecutorParams params)
      throws IOException, InterruptedException {
    ProcessBuilder builder = new ProcessBuilder(params.getCommand());
    params.getDirectory().ifPresent(directory -> builder.directory(directory.toFile()));
    if (!params.getEnvironment().isEmpty()) {
      builder.environment().clear();
      builder.environment().putAll(params.getEnvironment());
    }

    LOG.debug("Executing command: %s", Joiner.on(' ').join(params.getCommand()));
    Process process = builder.start();
    process.getOutputStream().close();

    // Drain stderr on another thread so neither pipe can fill up and block the child.
    CompletableFuture<String> stderr =
        CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()), stderrReader);
    String stdout = readFully(process.getInputStream());
    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }

    try {
      return new Result(exitCode, stdout, stderr.get());
    } catch (ExecutionException e) {
      throw new IOException("Failed to read stderr of " + params.getCommand(), e.getCause());
    }
  }

  private static String readFully(InputStream stream) {
    try (InputStream in = stream) {
      return new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
