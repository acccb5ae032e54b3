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

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DensityBucketMigratorTest {

  private FileSystem fs;

  @Before
  public void setUp() {
    fs = Jimfs.newFileSystem();
  }

  @Test
  public void movesMdpiImagesOutOfTheirBucket() throws IOException {
    DependencyResources dependency =
        ResourceDirs.create(
            fs,
            "lib",
            "drawable-mdpi-v4/icon.png",
            "drawable-mdpi/logo.webp",
            "drawable-mdpi/shape.xml",
            "drawable-hdpi/icon.png",
            "mipmap-mdpi/ic_launcher.png");

    DensityBucketMigrator.migrate(dependency);

    assertThat(ResourceDirs.listFiles(dependency))
        .containsExactly(
            "drawable-hdpi/icon.png",
            "drawable-mdpi/shape.xml",
            "drawable-v4/icon.png",
            "drawable/logo.webp",
            "mipmap-mdpi/ic_launcher.png");
    assertThat(ResourceDirs.read(dependency, "drawable-v4/icon.png"))
        .isEqualTo("drawable-mdpi-v4/icon.png");
    assertThat(dependency.getLedger().getEntries().first().toLedgerLine())
        .isEqualTo("Rename:drawable-v4/icon.png,drawable-mdpi-v4/icon.png");
  }

  @Test
  public void movesAreRecordedAgainstTheOriginalPath() throws IOException {
    DependencyResources dependency = ResourceDirs.create(fs, "lib", "drawable-mdpi/icon.webp");
    dependency
        .getLedger()
        .recordMove(fs.getPath("drawable-mdpi/icon.webp"), fs.getPath("drawable-mdpi/icon.png"));

    DensityBucketMigrator.migrate(dependency);

    assertThat(dependency.getLedger().getEntries())
        .containsExactly(
            RenameLedgerEntry.of(
                fs.getPath("drawable/icon.webp"), fs.getPath("drawable-mdpi/icon.png")));
  }

  @Test
  public void existingDestinationIsAnError() {
    IllegalStateException e =
        assertThrows(
            IllegalStateException.class,
            () ->
                DensityBucketMigrator.planMoves(
                    ImmutableList.of(
                        fs.getPath("drawable-mdpi/icon.png"), fs.getPath("drawable/icon.png"))));
    assertThat(e).hasMessageThat().contains("drawable/icon.png already exists");
  }
}
