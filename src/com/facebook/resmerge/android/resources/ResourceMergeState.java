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

package com.facebook.resmerge.android.resources;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/** The phases of a merge run, in the only order they may happen. */
public enum ResourceMergeState {
  EXTRACTED,
  NORMALIZED,
  FILTERED,
  RECOMPRESSED,
  LEDGER_WRITTEN,
  LINKED,
  VALIDATED,
  FINALIZED;

  /**
   * @param current the state reached so far, or {@code null} before the first phase.
   * @throws IllegalStateException unless {@code next} directly follows {@code current}.
   */
  public static ResourceMergeState advance(
      @Nullable ResourceMergeState current, ResourceMergeState next) {
    int expectedOrdinal = current == null ? 0 : current.ordinal() + 1;
    Preconditions.checkState(
        next.ordinal() == expectedOrdinal, "Cannot go from %s to %s", current, next);
    return next;
  }
}
