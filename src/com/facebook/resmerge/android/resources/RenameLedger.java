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

import com.facebook.resmerge.core.util.log.Logger;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The renames applied to one dependency's resource directory during a merge run.
 *
 * <p>The ledger holds at most one entry per current path, always pointing back at the path the
 * file had when the dependency archive was extracted. Renaming an already-renamed file replaces
 * its entry instead of adding a second one, so the ledger never contains chains.
 *
 * <p>Not thread-safe. Parallel phases collect their results first and record them from a single
 * thread once every worker has finished.
 */
public class RenameLedger {

  private static final Logger LOG = Logger.get(RenameLedger.class);

  private final Map<Path, Path> currentToOriginal = new HashMap<>();

  /**
   * Records that the file at {@code previousPath} is now (also) at {@code newPath}.
   *
   * @throws IllegalStateException if {@code newPath} is already recorded with a different original.
   */
  public void record(Path newPath, Path previousPath) {
    Preconditions.checkArgument(
        !newPath.equals(previousPath), "A rename must change the path: %s", newPath);
    Path original = currentToOriginal.getOrDefault(previousPath, previousPath);
    if (original.equals(newPath)) {
      // Back where it started.
      return;
    }
    Path existing = currentToOriginal.get(newPath);
    if (existing != null) {
      Preconditions.checkState(
          existing.equals(original),
          "Rename collision: %s is recorded as coming from %s, not %s",
          newPath,
          existing,
          original);
      return;
    }
    LOG.verbose("Rename %s -> %s (originally %s)", previousPath, newPath, original);
    currentToOriginal.put(newPath, original);
  }

  /**
   * Records that the file at {@code previousPath} was moved, so that path is vacated. Copies use
   * {@link #record} alone.
   */
  public void recordMove(Path newPath, Path previousPath) {
    record(newPath, previousPath);
    currentToOriginal.remove(previousPath);
  }

  /** Drops the entry of a file that no longer exists. */
  public void forget(Path deletedPath) {
    currentToOriginal.remove(deletedPath);
  }

  public Optional<Path> getOriginalPath(Path currentPath) {
    return Optional.ofNullable(currentToOriginal.get(currentPath));
  }

  public boolean isEmpty() {
    return currentToOriginal.isEmpty();
  }

  public int size() {
    return currentToOriginal.size();
  }

  public ImmutableSortedSet<RenameLedgerEntry> getEntries() {
    ImmutableSortedSet.Builder<RenameLedgerEntry> entries = ImmutableSortedSet.naturalOrder();
    for (Map.Entry<Path, Path> entry : currentToOriginal.entrySet()) {
      entries.add(RenameLedgerEntry.of(entry.getKey(), entry.getValue()));
    }
    return entries.build();
  }
}
