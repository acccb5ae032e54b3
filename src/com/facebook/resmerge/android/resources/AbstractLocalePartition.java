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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import org.immutables.value.Value;

/** The observed locales, split into four disjoint groups by a {@link LocalePolicySet}. */
@Value.Immutable
@ResMergeStyleImmutable
abstract class AbstractLocalePartition {

  /** Wanted and shared: left untouched. */
  @Value.NaturalOrder
  public abstract ImmutableSortedSet<String> getBoth();

  /** Wanted only: the shared strings are stripped. */
  @Value.NaturalOrder
  public abstract ImmutableSortedSet<String> getWantedOnly();

  /** Shared only: everything but the shared strings is stripped. */
  @Value.NaturalOrder
  public abstract ImmutableSortedSet<String> getSharedOnly();

  /** Neither: every string file is deleted. */
  @Value.NaturalOrder
  public abstract ImmutableSortedSet<String> getRemoved();

  @Value.Check
  protected void check() {
    Preconditions.checkState(
        Sets.intersection(getBoth(), getWantedOnly()).isEmpty()
            && Sets.intersection(getBoth(), getSharedOnly()).isEmpty()
            && Sets.intersection(getBoth(), getRemoved()).isEmpty()
            && Sets.intersection(getWantedOnly(), getSharedOnly()).isEmpty()
            && Sets.intersection(getWantedOnly(), getRemoved()).isEmpty()
            && Sets.intersection(getSharedOnly(), getRemoved()).isEmpty(),
        "Locale groups overlap: %s",
        this);
  }

  public ImmutableSortedSet<String> getAll() {
    return ImmutableSortedSet.<String>naturalOrder()
        .addAll(getBoth())
        .addAll(getWantedOnly())
        .addAll(getSharedOnly())
        .addAll(getRemoved())
        .build();
  }
}
