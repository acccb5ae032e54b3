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

import java.nio.file.Path;

/** A symbol table, exception list, archive or lookup entry that the run needs does not exist. */
public class MissingResourceException extends HumanReadableException {

  public MissingResourceException(String humanReadableFormatString, Object... args) {
    super(humanReadableFormatString, args);
  }

  public static MissingResourceException forPath(String what, Path path) {
    return new MissingResourceException("%s does not exist: %s", what, path);
  }
}
