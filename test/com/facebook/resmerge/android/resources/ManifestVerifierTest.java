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
import com.facebook.resmerge.core.exceptions.MissingResourceException;
import com.facebook.resmerge.core.exceptions.PolicyMismatchException;
import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ManifestVerifier}. */
@RunWith(JUnit4.class)
public class ManifestVerifierTest {

  private static final String MANIFEST =
      "<manifest package=\"com.example.app\">\n  <application/>\n</manifest>\n";

  private static final String DEBUGGABLE_MANIFEST =
      MANIFEST.replace("<application/>", "<application android:debuggable=\"true\"/>");

  private FileSystem fs;
  private Path actual;
  private Path expected;
  private Path normalized;

  @Before
  public void setUp() throws IOException {
    fs = Jimfs.newFileSystem();
    Files.createDirectories(fs.getPath("/work"));
    actual = fs.getPath("/work/AndroidManifest.xml");
    expected = fs.getPath("/work/AndroidManifest.expected");
    normalized = fs.getPath("/work/out/AndroidManifest.normalized.xml");
    write(actual, MANIFEST);
  }

  private static void write(Path path, String contents) throws IOException {
    Files.write(path, contents.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void normalization() {
    assertThat(ManifestVerifier.normalize("a  \r\nb\t\n\n\n")).isEqualTo("a\nb\n");
    assertThat(ManifestVerifier.normalize("a")).isEqualTo("a\n");
  }

  @Test
  public void diffMarksChangedLines() {
    assertThat(ManifestVerifier.diff(ImmutableList.of("a", "b"), ImmutableList.of("a", "b")))
        .isEmpty();
    assertThat(
            ManifestVerifier.diff(ImmutableList.of("a", "b", "c"), ImmutableList.of("a", "x", "c")))
        .containsExactly("  a", "+ x", "- b", "  c")
        .inOrder();
  }

  @Test
  public void matchingManifestIgnoresWhitespaceNoise() throws IOException {
    write(expected, MANIFEST.replace("\n", "  \r\n") + "\n\n");

    assertThat(ManifestVerifier.verify(actual, expected, normalized, true)).isTrue();
    assertThat(new String(Files.readAllBytes(normalized), StandardCharsets.UTF_8))
        .isEqualTo(MANIFEST);
  }

  @Test
  public void mismatchOnlyWarnsByDefault() throws IOException {
    write(expected, DEBUGGABLE_MANIFEST);

    assertThat(ManifestVerifier.verify(actual, expected, normalized, false)).isFalse();
    assertThat(Files.exists(normalized)).isTrue();
  }

  @Test
  public void mismatchFailsWhenStrict() throws IOException {
    write(expected, DEBUGGABLE_MANIFEST);

    PolicyMismatchException e =
        assertThrows(
            PolicyMismatchException.class,
            () -> ManifestVerifier.verify(actual, expected, normalized, true));
    assertThat(e).hasMessageThat().contains("needs updating");
    assertThat(e).hasMessageThat().contains("+   <application/>");
  }

  @Test
  public void missingExpectationFails() {
    assertThrows(
        MissingResourceException.class,
        () -> ManifestVerifier.verify(actual, expected, normalized, false));
  }

  @Test
  public void packageName() throws IOException {
    assertThat(ManifestVerifier.readPackageName(actual)).isEqualTo("com.example.app");

    write(actual, "<manifest/>");
    assertThrows(HumanReadableException.class, () -> ManifestVerifier.readPackageName(actual));
    assertThrows(
        MissingResourceException.class,
        () -> ManifestVerifier.readPackageName(fs.getPath("/work/missing.xml")));
  }
}
