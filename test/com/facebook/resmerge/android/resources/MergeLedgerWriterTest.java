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

import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MergeLedgerWriterTest {

  private FileSystem fs;
  private ProjectFilesystem output;

  @Before
  public void setUp() throws IOException {
    fs = Jimfs.newFileSystem();
    output = new ProjectFilesystem(fs.getPath("/out"));
  }

  private DependencyResources dependencyWithArchive(String name, String... upstreamLines)
      throws IOException {
    Path archive = fs.getPath("/archives", name + ".zip");
    Files.createDirectories(archive.getParent());
    Files.write(archive, new byte[0]);
    if (upstreamLines.length > 0) {
      Files.write(
          fs.getPath("/archives", name + ".zip.info"),
          ImmutableList.copyOf(upstreamLines),
          StandardCharsets.UTF_8);
    }
    return new DependencyResources(
        name, Optional.of(archive), new ProjectFilesystem(fs.getPath("/deps", name)));
  }

  @Test
  public void upstreamLedgerSitsNextToTheArchive() throws IOException {
    dependencyWithArchive("a", "Rename:x,y");
    dependencyWithArchive("b");

    assertThat(MergeLedgerWriter.getUpstreamLedger(fs.getPath("/archives/a.zip")))
        .hasValue(fs.getPath("/archives/a.zip.info"));
    assertThat(MergeLedgerWriter.getUpstreamLedger(fs.getPath("/archives/b.zip"))).isEmpty();
  }

  @Test
  public void mergesUpstreamAndLocalRenamesSorted() throws IOException {
    DependencyResources a =
        dependencyWithArchive("a", "Rename:values-iw/strings.xml,values-he/strings.xml", "");
    a.getLedger().recordMove(fs.getPath("drawable/icon.png"), fs.getPath("drawable-mdpi/icon.png"));
    DependencyResources b =
        dependencyWithArchive("b", "Rename:drawable/icon.png,drawable-mdpi/icon.png");

    Path ledger = fs.getPath("size.info");
    MergeLedgerWriter.write(ImmutableList.of(a, b), output, ledger);

    assertThat(output.readLines(ledger))
        .containsExactly(
            "Rename:drawable/icon.png,drawable-mdpi/icon.png",
            "Rename:values-iw/strings.xml,values-he/strings.xml")
        .inOrder();
  }

  @Test
  public void conflictingRenamesFail() throws IOException {
    DependencyResources a = dependencyWithArchive("a");
    a.getLedger().recordMove(fs.getPath("drawable/icon.png"), fs.getPath("drawable-mdpi/icon.png"));
    DependencyResources b = dependencyWithArchive("b");
    b.getLedger().recordMove(fs.getPath("drawable/icon.png"), fs.getPath("drawable-v4/icon.png"));

    HumanReadableException e =
        assertThrows(
            HumanReadableException.class,
            () -> MergeLedgerWriter.buildLedgerLines(ImmutableList.of(a, b)));
    assertThat(e).hasMessageThat().contains("Conflicting renames");
  }

  @Test
  public void ledgerIsWrittenOnce() throws IOException {
    Path ledger = fs.getPath("size.info");
    MergeLedgerWriter.write(ImmutableList.of(), output, ledger);

    assertThat(output.readLines(ledger)).isEmpty();
    assertThrows(
        IllegalStateException.class,
        () -> MergeLedgerWriter.write(ImmutableList.of(), output, ledger));
  }
}
