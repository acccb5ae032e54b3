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
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.jimfs.Jimfs;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class RenameLedgerTest {

  private FileSystem fs;
  private RenameLedger ledger;

  @Before
  public void setUp() {
    fs = Jimfs.newFileSystem();
    ledger = new RenameLedger();
  }

  private Path path(String path) {
    return fs.getPath(path);
  }

  @Test
  public void emptyLedger() {
    assertThat(ledger.isEmpty()).isTrue();
    assertThat(ledger.getEntries()).isEmpty();
    assertThat(ledger.getOriginalPath(path("values/strings.xml"))).isEmpty();
  }

  @Test
  public void chainsAreComposed() {
    ledger.recordMove(path("values-iw/strings.xml"), path("values-b+he/strings.xml"));
    ledger.recordMove(path("values-iw-rIL/strings.xml"), path("values-iw/strings.xml"));

    assertThat(ledger.size()).isEqualTo(1);
    assertThat(ledger.getOriginalPath(path("values-iw-rIL/strings.xml")))
        .hasValue(path("values-b+he/strings.xml"));
    assertThat(ledger.getEntries().first().toLedgerLine())
        .isEqualTo("Rename:values-iw-rIL/strings.xml,values-b+he/strings.xml");
  }

  @Test
  public void copiesKeepTheirSource() {
    ledger.record(path("values-zh-rHK/strings.xml"), path("values-zh-rTW/strings.xml"));

    assertThat(ledger.getOriginalPath(path("values-zh-rHK/strings.xml")))
        .hasValue(path("values-zh-rTW/strings.xml"));
    assertThat(ledger.getOriginalPath(path("values-zh-rTW/strings.xml"))).isEmpty();
  }

  @Test
  public void movingBackRemovesTheEntry() {
    ledger.recordMove(path("drawable-mdpi/a.png"), path("drawable/a.png"));
    ledger.recordMove(path("drawable/a.png"), path("drawable-mdpi/a.png"));

    assertThat(ledger.isEmpty()).isTrue();
  }

  @Test
  public void forgetDropsDeletedFiles() {
    ledger.record(path("values-zh-rHK/strings.xml"), path("values-zh-rTW/strings.xml"));
    ledger.forget(path("values-zh-rHK/strings.xml"));

    assertThat(ledger.isEmpty()).isTrue();
  }

  @Test
  public void conflictingOriginsAreRejected() {
    ledger.record(path("drawable-mdpi/a.png"), path("drawable/a.png"));

    assertThrows(
        IllegalStateException.class,
        () -> ledger.record(path("drawable-mdpi/a.png"), path("drawable-v4/a.png")));
  }

  @Test
  public void entriesAreSorted() {
    ledger.record(path("values-zh-rHK/strings.xml"), path("values-zh-rTW/strings.xml"));
    ledger.recordMove(path("drawable-mdpi/a.png"), path("drawable/a.png"));

    assertThat(ledger.getEntries())
        .containsExactly(
            RenameLedgerEntry.of(path("drawable-mdpi/a.png"), path("drawable/a.png")),
            RenameLedgerEntry.of(
                path("values-zh-rHK/strings.xml"), path("values-zh-rTW/strings.xml")))
        .inOrder();
  }

  @Test
  public void absolutePathsAreRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RenameLedgerEntry.of(path("/deps/a/drawable/a.png"), path("drawable/a.png")));
  }
}
