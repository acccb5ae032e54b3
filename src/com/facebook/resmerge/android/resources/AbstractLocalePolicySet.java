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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import java.util.Optional;
import java.util.Set;
import org.immutables.value.Value;

/**
 * Which locales of string resources go into the output. Locales are platform qualifiers ({@code
 * en-rUS}), as found in {@code values-*} directory names.
 *
 * <ul>
 *   <li>Wanted locales keep their strings, except the shared ones.
 *   <li>Shared locales keep the shared strings only.
 *   <li>Locales that are both keep everything, and locales that are neither are removed.
 * </ul>
 */
@Value.Immutable
@ResMergeStyleImmutable
abstract class AbstractLocalePolicySet {

  /** Absent means every observed locale is wanted. */
  public abstract Optional<ImmutableSortedSet<String>> getWantedLocales();

  /** Absent means the shared locales are the wanted ones. */
  public abstract Optional<ImmutableSortedSet<String>> getSharedLocales();

  /** Names of the string resources that belong to the shared subset. */
  public abstract ImmutableSet<String> getSharedStringNames();

  /** With neither allow-list, nothing is filtered. */
  public boolean isActive() {
    return getWantedLocales().isPresent() || getSharedLocales().isPresent();
  }

  /**
   * Builds a policy from allow-lists of language tags or legacy qualifiers, which may be mixed.
   *
   * <p>Each regional tag also keeps its language-only fallback, so {@code en-US} keeps {@code
   * en-rUS} and {@code en}. When {@code duplicator} is given, its target locale is added wherever
   * its source locale is.
   */
  public static LocalePolicySet fromLanguageTags(
      Optional<? extends Iterable<String>> wantedTags,
      Optional<? extends Iterable<String>> sharedTags,
      Set<String> sharedStringNames,
      Optional<PlatformDuplicator> duplicator) {
    LocalePolicySet.Builder builder = LocalePolicySet.builder();
    wantedTags.ifPresent(tags -> builder.setWantedLocales(toAndroidLocales(tags, duplicator)));
    sharedTags.ifPresent(
        tags -> {
          builder.setSharedLocales(toAndroidLocales(tags, duplicator));
          builder.addAllSharedStringNames(sharedStringNames);
        });
    return builder.build();
  }

  static ImmutableSortedSet<String> toAndroidLocales(
      Iterable<String> languageTags, Optional<PlatformDuplicator> duplicator) {
    ImmutableSortedSet.Builder<String> locales = ImmutableSortedSet.naturalOrder();
    boolean containsDuplicationSource = false;
    for (String tag : languageTags) {
      LocaleQualifier locale = LocaleQualifier.parseAllowListLocale(tag);
      locales.add(locale.toAndroidQualifier());
      locales.add(locale.getLanguageOnly().toAndroidQualifier());
      if (duplicator.isPresent() && locale.equals(duplicator.get().getSource())) {
        containsDuplicationSource = true;
      }
    }
    if (containsDuplicationSource) {
      locales.add(duplicator.get().getTarget().toAndroidQualifier());
    }
    return locales.build();
  }

  /** Splits the observed locales according to this policy. */
  public LocalePartition partition(Set<String> observedLocales) {
    Set<String> wanted = getWantedLocales().map(s -> (Set<String>) s).orElse(observedLocales);
    Set<String> shared = getSharedLocales().map(s -> (Set<String>) s).orElse(wanted);
    return LocalePartition.builder()
        .addAllBoth(Sets.intersection(observedLocales, Sets.intersection(wanted, shared)))
        .addAllWantedOnly(Sets.intersection(observedLocales, Sets.difference(wanted, shared)))
        .addAllSharedOnly(Sets.intersection(observedLocales, Sets.difference(shared, wanted)))
        .addAllRemoved(
            Sets.difference(observedLocales, Sets.union(wanted, shared)).immutableCopy())
        .build();
  }
}
