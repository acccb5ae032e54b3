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
import com.facebook.resmerge.io.GlobPatternMatcher;
import com.facebook.resmerge.io.MorePaths;
import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides which resource files are packaged.
 *
 * <p>Dotfiles are never kept. When a blacklist is configured, a file is dropped if the blacklist
 * finds a match in its resource-relative path, unless it is a mipmap or matches one of the
 * exception globs. A drawable is never dropped from only some densities, though: if any drawable
 * with the same name survives, in any dependency, every drawable with that name is kept.
 */
public class ResourceKeepFilter {

  private static final Logger LOG = Logger.get(ResourceKeepFilter.class);

  private final Optional<Pattern> blacklist;
  private final ImmutableList<GlobPatternMatcher> exceptions;

  public ResourceKeepFilter(Optional<Pattern> blacklist, Iterable<String> exceptionGlobs) {
    this.blacklist = blacklist;
    this.exceptions = GlobPatternMatcher.of(exceptionGlobs);
  }

  /** Keeps every file but dotfiles. */
  public static ResourceKeepFilter keepAll() {
    return new ResourceKeepFilter(Optional.empty(), ImmutableList.of());
  }

  /**
   * Builds the keep predicate for the given dependencies. The predicate takes resource-relative
   * paths. Nothing is deleted here.
   */
  public Predicate<Path> createKeepPredicate(Iterable<DependencyResources> dependencies)
      throws IOException {
    if (!blacklist.isPresent()) {
      return path -> !PathClassifier.classify(path).isDotFile();
    }

    ImmutableSet.Builder<String> survivingDrawables = ImmutableSet.builder();
    for (DependencyResources dependency : dependencies) {
      for (Path path : dependency.getFilesystem().getFilesUnderRoot()) {
        ResourcePath resourcePath = PathClassifier.classify(path);
        if (resourcePath.isDrawable() && isKeptIgnoringDensities(resourcePath)) {
          survivingDrawables.add(resourcePath.getName());
        }
      }
    }
    return createKeepPredicateForSurvivors(survivingDrawables.build());
  }

  /** The keep predicate, given the names of the drawables that survive in some density. */
  Predicate<Path> createKeepPredicateForSurvivors(ImmutableSet<String> survivingDrawableNames) {
    return path -> {
      ResourcePath resourcePath = PathClassifier.classify(path);
      if (resourcePath.isDotFile()) {
        return false;
      }
      return isKeptIgnoringDensities(resourcePath)
          || (resourcePath.isDrawable()
              && survivingDrawableNames.contains(resourcePath.getName()));
    };
  }

  private boolean isKeptIgnoringDensities(ResourcePath resourcePath) {
    if (resourcePath.isDotFile()) {
      return false;
    }
    if (!blacklist.isPresent() || resourcePath.isMipmap()) {
      return true;
    }
    String unixPath = MorePaths.pathWithUnixSeparators(resourcePath.getPath());
    return !blacklist.get().matcher(unixPath).find()
        || GlobPatternMatcher.matchesAny(exceptions, resourcePath.getPath());
  }

  /**
   * Deletes every file of {@code dependencies} rejected by {@code keep}.
   *
   * @return the number of deleted files.
   */
  public static int deleteRejected(
      Iterable<DependencyResources> dependencies, Predicate<Path> keep) throws IOException {
    int deleted = 0;
    for (DependencyResources dependency : dependencies) {
      ProjectFilesystem filesystem = dependency.getFilesystem();
      for (Path path : filesystem.getFilesUnderRoot()) {
        if (!keep.test(path)) {
          LOG.verbose("Dropping %s", filesystem.resolve(path));
          filesystem.deleteFileAtPath(path);
          dependency.getLedger().forget(path);
          deleted++;
        }
      }
    }
    if (deleted > 0) {
      LOG.debug("Dropped %d resource files", deleted);
    }
    return deleted;
  }
}
