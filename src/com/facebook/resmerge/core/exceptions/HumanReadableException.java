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

package com.facebook.resmerge.core.exceptions;

import javax.annotation.Nullable;

/**
 * Exception with an error message that can sensibly be displayed to the user without a stacktrace.
 * This exception is meant to be used for failures that are caused by the inputs or configuration
 * of a packaging run, as opposed to bugs in the pipeline itself.
 */
public class HumanReadableException extends RuntimeException
    implements ExceptionWithHumanReadableMessage {

  public HumanReadableException(String humanReadableFormatString, Object... args) {
    super(String.format(humanReadableFormatString, args));
  }

  public HumanReadableException(@Nullable Throwable cause, String humanReadableErrorMessage) {
    super(humanReadableErrorMessage, cause);
  }

  public HumanReadableException(
      @Nullable Throwable cause, String humanReadableFormatString, Object... args) {
    super(String.format(humanReadableFormatString, args), cause);
  }

  @Override
  public String getHumanReadableErrorMessage() {
    return getMessage();
  }
}
