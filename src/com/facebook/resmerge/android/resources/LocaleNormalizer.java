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
import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Moves string resources filed under a non-canonical locale qualifier to the qualifier older
 * platform releases understand.
 *
 * <p>Older releases only support ISO 639-1 two-letter codes, sometimes in their obsolete spelling.
 * In practice:
 *
 * <ul>
 *   <li>{@code values-he/} moves to {@code values-iw/}, and likewise for Indonesian and Yiddish.
 *   <li>{@code values-fil/} moves to {@code values-tl/}; other three-letter codes with a two-letter
 *       equivalent collapse to it.
 *   <li>{@code values-no/} moves to {@code values-nb/}.
 *   <li>{@code values-b+en+US/} moves to {@code values-en-rUS/}.
 * </ul>
 *
 * A file whose destination already exists stays where it is: some libraries ship both {@code
 * values-nb/} and {@code values-no/} with the same content.
 */
public class LocaleNormalizer {

  private static final Logger LOG = Logger.get(LocaleNormalizer.class);

  /**
   * Computes the moves for one resource directory, without touching it.
   *
   * @param files every file of the directory, relative to its root, in sorted order.
   * @return one entry per move, mapping the destination to the source.
   */
  public static ImmutableList<RenameLedgerEntry> planRenames(Iterable<Path> files) {
    Set<Path> occupied = new HashSet<>();
    files.forEach(occupied::add);

    ImmutableList.Builder<RenameLedgerEntry> moves = ImmutableList.builder();
    for (Path file : files) {
      ResourcePath resourcePath = PathClassifier.classify(file);
      Optional<String> observed = resourcePath.getStringLocaleQualifier();
      if (!observed.isPresent()) {
        continue;
      }
      String canonical = resourcePath.getStringLocale().get().toAndroidQualifier();
      if (canonical.equals(observed.get())) {
        continue;
      }
      // Only values-<qualifier>/<file> is classified: a differing qualifier is another directory.
      Path destination =
          file.getFileSystem()
              .getPath(PathClassifier.VALUES + "-" + canonical, file.getFileName().toString());
      if (occupied.contains(destination)) {
        LOG.debug("Not moving %s: %s already exists", file, destination);
        continue;
      }
      occupied.remove(file);
      occupied.add(destination);
      moves.add(RenameLedgerEntry.of(destination, file));
    }
    return moves.build();
  }

  /** Applies {@link #planRenames} to a dependency and records the moves in its ledger. */
  public static ImmutableList<RenameLedgerEntry> normalize(DependencyResources dependency)
      throws IOException {
    ProjectFilesystem filesystem = dependency.getFilesystem();
    ImmutableList<RenameLedgerEntry> moves = planRenames(filesystem.getFilesUnderRoot());
    for (RenameLedgerEntry move : moves) {
      filesystem.move(move.getOriginalPath(), move.getNewPath());
      dependency.getLedger().recordMove(move.getNewPath(), move.getOriginalPath());
    }
    if (!moves.isEmpty()) {
      LOG.debug("Moved %d locale string files in %s", moves.size(), dependency.getName());
    }
    return moves;
  }

  public static void normalizeAll(Iterable<DependencyResources> dependencies) throws IOException {
    for (DependencyResources dependency : dependencies) {
      normalize(dependency);
    }
  }

  /** Utility class: do not instantiate. */
  private LocaleNormalizer() {}
}
