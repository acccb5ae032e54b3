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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResourceMergeStateTest {

  @Test
  public void statesAdvanceInOrder() {
    ResourceMergeState state = null;
    for (ResourceMergeState next : ResourceMergeState.values()) {
      state = ResourceMergeState.advance(state, next);
    }
    assertThat(state).isEqualTo(ResourceMergeState.FINALIZED);
  }

  @Test
  public void skippingAPhaseFails() {
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () ->
                ResourceMergeState.advance(
                    ResourceMergeState.FILTERED, ResourceMergeState.LINKED));
    assertThat(e).hasMessageThat().isEqualTo("Cannot go from FILTERED to LINKED");
  }

  @Test
  public void runsStartByExtracting() {
    assertThrows(
        IllegalStateException.class,
        () -> ResourceMergeState.advance(null, ResourceMergeState.NORMALIZED));
    assertThrows(
        IllegalStateException.class,
        () ->
            ResourceMergeState.advance(
                ResourceMergeState.FINALIZED, ResourceMergeState.EXTRACTED));
  }
}
