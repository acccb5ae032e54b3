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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Moves images out of {@code drawable-*mdpi*} directories into the same directory without the
 * {@code mdpi} qualifier, e.g. {@code drawable-mdpi-v4/icon.png} to {@code drawable-v4/icon.png}.
 * Works around http://crbug.com/289843. Other densities are left alone.
 */
public class DensityBucketMigrator {

  private static final Logger LOG = Logger.get(DensityBucketMigrator.class);

  static final ImmutableSet<String> MOVED_EXTENSIONS = ImmutableSet.of("png", "webp");

  /** Utility class: do not instantiate. */
  private DensityBucketMigrator() {}

  /**
   * Computes the moves for one resource directory, without touching it.
   *
   * @return one entry per move, mapping the destination to the source.
   * @throws IllegalStateException if a destination already exists.
   */
  public static ImmutableList<RenameLedgerEntry> planMoves(Iterable<Path> files) {
    Set<Path> occupied = new HashSet<>();
    files.forEach(occupied::add);

    ImmutableList.Builder<RenameLedgerEntry> moves = ImmutableList.builder();
    for (Path file : files) {
      ResourcePath resourcePath = PathClassifier.classify(file);
      if (!resourcePath.isDrawable()
          || !resourcePath.getQualifiers().contains(Density.MDPI.getQualifier())
          || !MOVED_EXTENSIONS.contains(resourcePath.getExtension())) {
        continue;
      }
      ImmutableList<String> qualifiers =
          resourcePath.getQualifiers().stream()
              .filter(qualifier -> !qualifier.equals(Density.MDPI.getQualifier()))
              .collect(ImmutableList.toImmutableList());
      Path destination = resourcePath.withQualifiers(qualifiers);
      Preconditions.checkState(
          occupied.add(destination), "Cannot move %s: %s already exists", file, destination);
      moves.add(RenameLedgerEntry.of(destination, file));
    }
    return moves.build();
  }

  /** Applies {@link #planMoves} to a dependency and records the moves in its ledger. */
  public static ImmutableList<RenameLedgerEntry> migrate(DependencyResources dependency)
      throws IOException {
    ProjectFilesystem filesystem = dependency.getFilesystem();
    ImmutableList<RenameLedgerEntry> moves = planMoves(filesystem.getFilesUnderRoot());
    for (RenameLedgerEntry move : moves) {
      filesystem.move(move.getOriginalPath(), move.getNewPath());
      dependency.getLedger().recordMove(move.getNewPath(), move.getOriginalPath());
    }
    if (!moves.isEmpty()) {
      LOG.debug("Moved %d mdpi images in %s", moves.size(), dependency.getName());
    }
    return moves;
  }

  public static void migrateAll(Iterable<DependencyResources> dependencies) throws IOException {
    for (DependencyResources dependency : dependencies) {
      migrate(dependency);
    }
  }
}
