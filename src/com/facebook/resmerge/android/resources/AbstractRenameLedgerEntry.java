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

import com.facebook.resmerge.core.util.immutables.ResMergeStyleImmutable;
import com.facebook.resmerge.io.MorePaths;
import com.google.common.base.Preconditions;
import java.nio.file.Path;
import org.immutables.value.Value;

/** One rename: the path a resource now lives at, and the path it had in its dependency archive. */
@Value.Immutable
@ResMergeStyleImmutable
abstract class AbstractRenameLedgerEntry implements Comparable<AbstractRenameLedgerEntry> {

  static final String LINE_PREFIX = "Rename:";

  @Value.Parameter
  public abstract Path getNewPath();

  @Value.Parameter
  public abstract Path getOriginalPath();

  @Value.Check
  protected void check() {
    Preconditions.checkArgument(
        !getNewPath().isAbsolute() && !getOriginalPath().isAbsolute(),
        "Ledger paths must be relative to their resource directory: %s",
        this);
  }

  /** The line format shared with the ledgers shipped next to dependency archives. */
  public String toLedgerLine() {
    return LINE_PREFIX
        + MorePaths.pathWithUnixSeparators(getNewPath())
        + ","
        + MorePaths.pathWithUnixSeparators(getOriginalPath());
  }

  @Override
  public int compareTo(AbstractRenameLedgerEntry other) {
    return toLedgerLine().compareTo(other.toLedgerLine());
  }
}
