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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.SortedSetMultimap;
import com.google.common.collect.TreeMultimap;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Removes the localized strings that should not go into the output, following a {@link
 * LocalePolicySet}. Files emptied by filtering are kept.
 */
public class LocaleStringFilter {

  private static final Logger LOG = Logger.get(LocaleStringFilter.class);

  private final LocalePolicySet policy;

  public LocaleStringFilter(LocalePolicySet policy) {
    this.policy = policy;
  }

  /** @return how the observed locales were split, or empty if the policy filters nothing. */
  public Optional<LocalePartition> filter(Iterable<DependencyResources> dependencies)
      throws IOException {
    if (!policy.isActive()) {
      return Optional.empty();
    }

    SortedSetMultimap<String, LocalizedFile> filesByLocale =
        TreeMultimap.create(Comparator.naturalOrder(), LocalizedFile.ORDERING);
    for (DependencyResources dependency : dependencies) {
      for (Path path : dependency.getFilesystem().getFilesUnderRoot()) {
        Optional<String> locale = PathClassifier.classify(path).getStringLocaleQualifier();
        if (locale.isPresent()) {
          filesByLocale.put(locale.get(), new LocalizedFile(dependency, path));
        }
      }
    }

    LocalePartition partition = policy.partition(filesByLocale.keySet());
    LOG.debug("Locale partition: %s", partition);

    for (String locale : partition.getRemoved()) {
      for (LocalizedFile file : filesByLocale.get(locale)) {
        file.dependency.getFilesystem().deleteFileAtPath(file.path);
        file.dependency.getLedger().forget(file.path);
      }
    }

    ImmutableSet<String> sharedNames = policy.getSharedStringNames();
    rewrite(filesByLocale, partition.getSharedOnly(), sharedNames::contains);
    rewrite(filesByLocale, partition.getWantedOnly(), name -> !sharedNames.contains(name));
    return Optional.of(partition);
  }

  private static void rewrite(
      SortedSetMultimap<String, LocalizedFile> filesByLocale,
      Iterable<String> locales,
      Predicate<String> keep)
      throws IOException {
    for (String locale : locales) {
      for (LocalizedFile file : filesByLocale.get(locale)) {
        ProjectFilesystem filesystem = file.dependency.getFilesystem();
        int removed = StringResourcesXml.filter(filesystem, file.path, keep);
        if (removed > 0) {
          LOG.verbose("Removed %d strings from %s", removed, filesystem.resolve(file.path));
        }
      }
    }
  }

  private static class LocalizedFile {
    static final Comparator<LocalizedFile> ORDERING =
        Comparator.<LocalizedFile, String>comparing(f -> f.dependency.getName())
            .thenComparing(f -> f.path);

    final DependencyResources dependency;
    final Path path;

    LocalizedFile(DependencyResources dependency, Path path) {
      this.dependency = dependency;
      this.path = path;
    }
  }

  @Override
  public String toString() {
    return "LocaleStringFilter{" + policy + "}";
  }
}
