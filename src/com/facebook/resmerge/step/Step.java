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

import java.io.IOException;

/** Steps are executed in order, typically by a {@link DefaultStepRunner}. */
public interface Step {

  StepExecutionResult execute(ExecutionContext context) throws IOException, InterruptedException;

  /** @return a short name/description for the command, such as "aapt2_link". */
  String getShortName();

  /**
   * @return a string that describes what the command does. For a shell step, this is the command
   *     line that would be run.
   */
  String getDescription(ExecutionContext context);
}
