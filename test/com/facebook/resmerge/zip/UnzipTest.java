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

package com.facebook.resmerge.zip;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.collect.ImmutableMap;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class UnzipTest {

  private FileSystem fs;
  private ProjectFilesystem filesystem;

  @Before
  public void setUp() {
    fs = Jimfs.newFileSystem();
    filesystem = new ProjectFilesystem(fs.getPath("/out"));
  }

  @Test
  public void extractsFilesUnderTheRoot() throws IOException {
    Path zip =
        TestZips.write(
            fs.getPath("/res.zip"),
            ImmutableMap.of(
                "values/", "",
                "values/strings.xml", "<resources/>",
                "drawable-hdpi/icon.png", "png"));

    assertThat(Unzip.extractZipFile(zip, filesystem))
        .containsExactly(fs.getPath("drawable-hdpi/icon.png"), fs.getPath("values/strings.xml"));
    assertThat(filesystem.readFileIfItExists(fs.getPath("values/strings.xml")))
        .isEqualTo(Optional.of("<resources/>"));
  }

  @Test
  public void entriesMayNotEscapeTheRoot() throws IOException {
    Path zip = TestZips.write(fs.getPath("/evil.zip"), ImmutableMap.of("../evil.txt", "x"));

    assertThrows(IOException.class, () -> Unzip.extractZipFile(zip, filesystem));
    assertThat(Files.exists(fs.getPath("/evil.txt"))).isFalse();
  }
}
