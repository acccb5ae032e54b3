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

import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Writes the rename ledger of a merge run: the renames of this run plus those of the ledgers
 * shipped next to each dependency archive ({@code <archive>.info}), one {@code
 * Rename:<new>,<original>} line each, deduplicated and sorted.
 */
public class MergeLedgerWriter {

  private static final Logger LOG = Logger.get(MergeLedgerWriter.class);

  static final String UPSTREAM_LEDGER_SUFFIX = ".info";

  /** Utility class: do not instantiate. */
  private MergeLedgerWriter() {}

  public static Optional<Path> getUpstreamLedger(Path archive) {
    Path ledger = archive.resolveSibling(archive.getFileName() + UPSTREAM_LEDGER_SUFFIX);
    return Files.isRegularFile(ledger) ? Optional.of(ledger) : Optional.empty();
  }

  /**
   * @throws HumanReadableException if two renames give the same new path different originals.
   */
  public static ImmutableSortedSet<String> buildLedgerLines(
      Iterable<DependencyResources> dependencies) throws IOException {
    ImmutableSortedSet.Builder<String> lines = ImmutableSortedSet.naturalOrder();
    for (DependencyResources dependency : dependencies) {
      Optional<Path> upstream =
          dependency.getArchive().flatMap(MergeLedgerWriter::getUpstreamLedger);
      if (upstream.isPresent()) {
        for (String line :
            MoreFiles.asCharSource(upstream.get(), StandardCharsets.UTF_8).readLines()) {
          if (!line.trim().isEmpty()) {
            lines.add(line.trim());
          }
        }
      }
      for (RenameLedgerEntry entry : dependency.getLedger().getEntries()) {
        lines.add(entry.toLedgerLine());
      }
    }
    ImmutableSortedSet<String> result = lines.build();
    checkNoConflicts(result);
    return result;
  }

  private static void checkNoConflicts(Iterable<String> lines) {
    Map<String, String> originals = new HashMap<>();
    for (String line : lines) {
      if (!line.startsWith(AbstractRenameLedgerEntry.LINE_PREFIX)) {
        continue;
      }
      String paths = line.substring(AbstractRenameLedgerEntry.LINE_PREFIX.length());
      int comma = paths.indexOf(',');
      if (comma < 0) {
        throw new HumanReadableException("Malformed rename ledger line: %s", line);
      }
      String newPath = paths.substring(0, comma);
      String original = paths.substring(comma + 1);
      String previous = originals.putIfAbsent(newPath, original);
      if (previous != null && !previous.equals(original)) {
        throw new HumanReadableException(
            "Conflicting renames: %s comes from both %s and %s", newPath, previous, original);
      }
    }
  }

  /**
   * Writes the ledger. A ledger is written once per run.
   *
   * @throws IllegalStateException if {@code output} already exists.
   */
  public static ImmutableSortedSet<String> write(
      Iterable<DependencyResources> dependencies, ProjectFilesystem filesystem, Path output)
      throws IOException {
    Preconditions.checkState(
        !filesystem.exists(output), "Rename ledger %s was already written", output);
    ImmutableSortedSet<String> lines = buildLedgerLines(dependencies);
    filesystem.writeLinesToPath(lines, output);
    LOG.debug("Wrote %d rename ledger lines to %s", lines.size(), filesystem.resolve(output));
    return lines;
  }
}
