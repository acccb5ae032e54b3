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

package com.facebook.resmerge.io;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystem;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ProjectFilesystemTest {

  private FileSystem fs;
  private ProjectFilesystem filesystem;

  @Before
  public void setUp() {
    fs = Jimfs.newFileSystem();
    filesystem = new ProjectFilesystem(fs.getPath("/root"));
  }

  private Path path(String path) {
    return fs.getPath(path);
  }

  @Test
  public void filesAreListedRelativeAndSorted() throws IOException {
    filesystem.writeContentsToPath("b", path("values/strings.xml"));
    filesystem.writeContentsToPath("a", path("drawable/icon.png"));
    filesystem.mkdirs(path("empty"));

    assertThat(filesystem.getFilesUnderRoot())
        .containsExactly(path("drawable/icon.png"), path("values/strings.xml"))
        .inOrder();
    assertThat(filesystem.getFilesUnderPath(path("drawable"), p -> true))
        .containsExactly(path("drawable/icon.png"));
    assertThat(filesystem.getFilesUnderPath(path("missing"), p -> true)).isEmpty();
    assertThat(filesystem.isDirectory(path("empty"))).isTrue();
  }

  @Test
  public void movesAndCopiesCreateParents() throws IOException {
    filesystem.writeContentsToPath("x", path("a/x.txt"));

    filesystem.copyFile(path("a/x.txt"), path("b/c/x.txt"));
    filesystem.move(path("a/x.txt"), path("d/x.txt"));

    assertThat(filesystem.exists(path("a/x.txt"))).isFalse();
    assertThat(filesystem.readFileIfItExists(path("b/c/x.txt"))).hasValue("x");
    assertThat(filesystem.readFileIfItExists(path("d/x.txt"))).hasValue("x");
    assertThrows(
        FileAlreadyExistsException.class,
        () -> filesystem.move(path("d/x.txt"), path("b/c/x.txt")));
  }

  @Test
  public void linesAndDeletion() throws IOException {
    filesystem.writeLinesToPath(ImmutableList.of("one", "two"), path("out/lines.txt"));

    assertThat(filesystem.readLines(path("out/lines.txt"))).containsExactly("one", "two").inOrder();
    filesystem.deleteFileAtPath(path("out/lines.txt"));
    assertThat(filesystem.exists(path("out/lines.txt"))).isFalse();
    assertThrows(
        NoSuchFileException.class, () -> filesystem.deleteFileAtPath(path("out/lines.txt")));
    filesystem.deleteRecursivelyIfExists(path("out"));
    assertThat(filesystem.isDirectory(path("out"))).isFalse();
    assertThat(filesystem.readFileIfItExists(path("out/lines.txt"))).isEmpty();
  }

  @Test
  public void resolvesAgainstTheRoot() {
    assertThat(filesystem.resolve("values")).isEqualTo(path("/root/values"));
    assertThat(filesystem.relativize(path("/root/values/a.xml"))).isEqualTo(path("values/a.xml"));
  }
}
