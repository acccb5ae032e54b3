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

/** A {@link Step} that runs in-process and describes itself with its short name. */
public abstract class AbstractExecutionStep implements Step {

  private final String description;

  public AbstractExecutionStep(String description) {
    this.description = description;
  }

  @Override
  public String getShortName() {
    return description;
  }

  @Override
  public String getDescription(ExecutionContext context) {
    return description;
  }
}
