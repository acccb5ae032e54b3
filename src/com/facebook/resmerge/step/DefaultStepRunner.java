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

import com.facebook.resmerge.core.util.log.Logger;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.ExecutionException;

/** Runs steps and turns every unsuccessful result into a {@link StepFailedException}. */
public class DefaultStepRunner {

  private static final Logger LOG = Logger.get(DefaultStepRunner.class);

  private final ExecutionContext context;

  public DefaultStepRunner(ExecutionContext context) {
    this.context = context;
  }

  public void runStep(Step step) throws StepFailedException, InterruptedException {
    LOG.debug("Running step %s: %s", step.getShortName(), step.getDescription(context));
    StepExecutionResult result;
    try {
      result = step.execute(context);
    } catch (IOException | RuntimeException e) {
      throw StepFailedException.createForFailingStepWithException(step, context, e);
    }
    if (!result.isSuccess()) {
      throw StepFailedException.createForFailingStepWithExitCode(step, context, result);
    }
  }

  public void runSteps(List<? extends Step> steps)
      throws StepFailedException, InterruptedException {
    for (Step step : steps) {
      runStep(step);
    }
  }

  /**
   * Run multiple steps in parallel and block waiting for all of them to finish. If any step fails,
   * the first failure (in submission order) is rethrown once all steps have completed.
   */
  public void runStepsInParallelAndWait(
      List<? extends Step> steps, ListeningExecutorService executorService)
      throws StepFailedException, InterruptedException {
    ImmutableList.Builder<ListenableFuture<Void>> builder = ImmutableList.builder();
    for (Step step : steps) {
      builder.add(
          executorService.submit(
              () -> {
                runStep(step);
                return null;
              }));
    }

    ImmutableList<ListenableFuture<Void>> futures = builder.build();
    try {
      Futures.successfulAsList(futures).get();
      for (ListenableFuture<Void> future : futures) {
        future.get();
      }
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, StepFailedException.class);
      Throwables.throwIfInstanceOf(cause, InterruptedException.class);
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException(cause);
    }
  }
}
