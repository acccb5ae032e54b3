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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link LocalePolicySet} and {@link LocalePartition}. */
@RunWith(JUnit4.class)
public class LocalePolicySetTest {

  private static final ImmutableSet<String> OBSERVED =
      ImmutableSet.of("en", "en-rGB", "fr", "de", "zh-rTW", "zh-rHK", "iw");

  @Test
  public void withoutAllowListsEverythingIsKept() {
    LocalePolicySet policy =
        LocalePolicySet.fromLanguageTags(
            Optional.empty(), Optional.empty(), ImmutableSet.of("app_name"), Optional.empty());

    assertThat(policy.isActive()).isFalse();
    assertThat(policy.getSharedStringNames()).isEmpty();
    LocalePartition partition = policy.partition(OBSERVED);
    assertThat(partition.getBoth()).containsExactlyElementsIn(OBSERVED);
    assertThat(partition.getRemoved()).isEmpty();
  }

  @Test
  public void regionalTagsKeepTheirLanguage() {
    LocalePolicySet policy =
        LocalePolicySet.fromLanguageTags(
            Optional.of(ImmutableList.of("en-GB", "he")),
            Optional.empty(),
            ImmutableSet.of(),
            Optional.empty());

    assertThat(policy.getWantedLocales().get()).containsExactly("en", "en-rGB", "iw").inOrder();
    LocalePartition partition = policy.partition(OBSERVED);
    assertThat(partition.getBoth()).containsExactly("en", "en-rGB", "iw");
    assertThat(partition.getRemoved()).containsExactly("de", "fr", "zh-rHK", "zh-rTW");
  }

  @Test
  public void duplicationTargetFollowsItsSource() {
    LocalePolicySet policy =
        LocalePolicySet.fromLanguageTags(
            Optional.of(ImmutableList.of("zh-TW")),
            Optional.empty(),
            ImmutableSet.of(),
            Optional.of(PlatformDuplicator.createDefault()));

    assertThat(policy.getWantedLocales().get()).containsExactly("zh", "zh-rHK", "zh-rTW");
  }

  @Test
  public void partitionIsDisjointAndComplete() {
    LocalePolicySet policy =
        LocalePolicySet.fromLanguageTags(
            Optional.of(ImmutableList.of("en", "de")),
            Optional.of(ImmutableList.of("en", "fr")),
            ImmutableSet.of("app_name"),
            Optional.empty());

    LocalePartition partition = policy.partition(OBSERVED);

    assertThat(partition.getBoth()).containsExactly("en");
    assertThat(partition.getWantedOnly()).containsExactly("de");
    assertThat(partition.getSharedOnly()).containsExactly("fr");
    assertThat(partition.getRemoved()).containsExactly("en-rGB", "iw", "zh-rHK", "zh-rTW");
    assertThat(partition.getAll()).containsExactlyElementsIn(OBSERVED);
    assertThat(policy.getSharedStringNames()).containsExactly("app_name");
  }

  @Test
  public void sharedLocalesDefaultToWantedOnes() {
    LocalePolicySet policy =
        LocalePolicySet.fromLanguageTags(
            Optional.of(ImmutableList.of("fr")),
            Optional.empty(),
            ImmutableSet.of("app_name"),
            Optional.empty());

    LocalePartition partition = policy.partition(OBSERVED);
    assertThat(partition.getBoth()).containsExactly("fr");
    assertThat(partition.getWantedOnly()).isEmpty();
    assertThat(partition.getSharedOnly()).isEmpty();
  }

  @Test
  public void allowListsMixQualifiersAndTags() {
    LocalePolicySet policy =
        LocalePolicySet.fromLanguageTags(
            Optional.of(ImmutableList.of("en-rGB", "zh-TW", "in")),
            Optional.empty(),
            ImmutableSet.of(),
            Optional.empty());

    assertThat(policy.getWantedLocales().get())
        .containsExactly("en", "en-rGB", "in", "zh", "zh-rTW")
        .inOrder();
  }

  @Test
  public void unsupportedTagsAreRejected() {
    assertThrows(
        HumanReadableException.class,
        () ->
            LocalePolicySet.fromLanguageTags(
                Optional.of(ImmutableList.of("sr-Latn")),
                Optional.empty(),
                ImmutableSet.of(),
                Optional.empty()));
    assertThrows(
        HumanReadableException.class,
        () ->
            LocalePolicySet.fromLanguageTags(
                Optional.of(ImmutableList.of("en-rGB", "b+sr+Latn")),
                Optional.empty(),
                ImmutableSet.of(),
                Optional.empty()));
  }
}
