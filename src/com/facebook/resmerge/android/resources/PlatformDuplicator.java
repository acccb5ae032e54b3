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

import com.facebook.resmerge.core.exceptions.ConfigurationContradictionException;
import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Copies the resources of one locale into the directories of another locale the app does not
 * translate for. By default Taiwanese resources serve Hong Kong, mirroring what native code does
 * when the device locale is zh-HK.
 */
public class PlatformDuplicator {

  private static final Logger LOG = Logger.get(PlatformDuplicator.class);

  public static final LocaleQualifier DEFAULT_SOURCE = LocaleQualifier.of("zh", "TW");
  public static final LocaleQualifier DEFAULT_TARGET = LocaleQualifier.of("zh", "HK");

  private final LocaleQualifier source;
  private final LocaleQualifier target;
  private final ImmutableList<String> sourceTokens;
  private final ImmutableList<String> targetTokens;

  public PlatformDuplicator(LocaleQualifier source, LocaleQualifier target) {
    this.source = source;
    this.target = target;
    this.sourceTokens = tokenize(source);
    this.targetTokens = tokenize(target);
  }

  public static PlatformDuplicator createDefault() {
    return new PlatformDuplicator(DEFAULT_SOURCE, DEFAULT_TARGET);
  }

  private static ImmutableList<String> tokenize(LocaleQualifier locale) {
    return ImmutableList.copyOf(Splitter.on('-').split(locale.toAndroidQualifier()));
  }

  public LocaleQualifier getSource() {
    return source;
  }

  public LocaleQualifier getTarget() {
    return target;
  }

  /**
   * Fails if the target locale was requested explicitly: its own resources would then be shadowed
   * by the copies.
   */
  public void checkTargetNotRequested(Iterable<LocaleQualifier> requestedLocales) {
    for (LocaleQualifier locale : requestedLocales) {
      if (locale.equals(target)) {
        throw new ConfigurationContradictionException(
            "%s is requested explicitly, so it cannot also be filled with copies of %s",
            target,
            source);
      }
    }
  }

  /**
   * Computes the copies for one resource directory, without touching it.
   *
   * @return one entry per copy, mapping the copy to the file it duplicates.
   */
  public ImmutableList<RenameLedgerEntry> planCopies(Iterable<Path> files) {
    Set<Path> existing = new HashSet<>();
    files.forEach(existing::add);

    ImmutableList.Builder<RenameLedgerEntry> copies = ImmutableList.builder();
    for (Path file : files) {
      ResourcePath resourcePath = PathClassifier.classify(file);
      if (!resourcePath.isGoverned()) {
        continue;
      }
      List<String> qualifiers = new ArrayList<>(resourcePath.getQualifiers());
      int index = Collections.indexOfSubList(qualifiers, sourceTokens);
      if (index < 0) {
        continue;
      }
      qualifiers.subList(index, index + sourceTokens.size()).clear();
      qualifiers.addAll(index, targetTokens);
      Path copy = resourcePath.withQualifiers(ImmutableList.copyOf(qualifiers));
      if (existing.contains(copy)) {
        LOG.debug("Not duplicating %s: %s already exists", file, copy);
        continue;
      }
      copies.add(RenameLedgerEntry.of(copy, file));
    }
    return copies.build();
  }

  /** Applies {@link #planCopies} to a dependency and records the copies in its ledger. */
  public ImmutableList<RenameLedgerEntry> duplicate(DependencyResources dependency)
      throws IOException {
    ProjectFilesystem filesystem = dependency.getFilesystem();
    ImmutableList<RenameLedgerEntry> copies = planCopies(filesystem.getFilesUnderRoot());
    for (RenameLedgerEntry copy : copies) {
      filesystem.copyFile(copy.getOriginalPath(), copy.getNewPath());
      dependency.getLedger().record(copy.getNewPath(), copy.getOriginalPath());
    }
    if (!copies.isEmpty()) {
      LOG.debug(
          "Copied %d %s resources to %s in %s",
          copies.size(),
          source,
          target,
          dependency.getName());
    }
    return copies;
  }

  public void duplicateAll(Iterable<DependencyResources> dependencies) throws IOException {
    for (DependencyResources dependency : dependencies) {
      duplicate(dependency);
    }
  }
}
