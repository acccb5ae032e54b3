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

import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.facebook.resmerge.core.exceptions.MissingResourceException;
import com.facebook.resmerge.core.exceptions.PolicyMismatchException;
import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.util.xml.XmlDomParser;
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/** Compares the manifest handed to the linker with a checked-in expectation. */
public class ManifestVerifier {

  private static final Logger LOG = Logger.get(ManifestVerifier.class);

  /** Utility class: do not instantiate. */
  private ManifestVerifier() {}

  /**
   * Unifies line endings, strips trailing whitespace and trailing blank lines, and ends the text
   * with a single newline.
   */
  public static String normalize(String manifest) {
    List<String> lines = Lists.newArrayList();
    for (String line : Splitter.onPattern("\\r?\\n|\\r").split(manifest)) {
      lines.add(CharMatcher.whitespace().trimTrailingFrom(line));
    }
    while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
      lines.remove(lines.size() - 1);
    }
    return Joiner.on('\n').join(lines) + "\n";
  }

  /**
   * A line diff turning {@code expected} into {@code actual}, as {@code -} and {@code +} lines.
   * Empty if they are equal.
   */
  public static ImmutableList<String> diff(List<String> expected, List<String> actual) {
    int n = expected.size();
    int m = actual.size();
    int[][] common = new int[n + 1][m + 1];
    for (int i = n - 1; i >= 0; i--) {
      for (int j = m - 1; j >= 0; j--) {
        common[i][j] =
            expected.get(i).equals(actual.get(j))
                ? common[i + 1][j + 1] + 1
                : Math.max(common[i + 1][j], common[i][j + 1]);
      }
    }

    ImmutableList.Builder<String> diff = ImmutableList.builder();
    int i = 0;
    int j = 0;
    boolean changed = false;
    while (i < n || j < m) {
      if (i < n && j < m && expected.get(i).equals(actual.get(j))) {
        diff.add("  " + expected.get(i));
        i++;
        j++;
      } else if (j < m && (i == n || common[i][j + 1] >= common[i + 1][j])) {
        diff.add("+ " + actual.get(j++));
        changed = true;
      } else {
        diff.add("- " + expected.get(i++));
        changed = true;
      }
    }
    return changed ? diff.build() : ImmutableList.of();
  }

  /**
   * Normalizes {@code actual}, writes the result to {@code normalizedOutput}, and compares it with
   * {@code expected}.
   *
   * @param strict whether a mismatch fails, or only warns.
   * @return whether the manifests match.
   * @throws PolicyMismatchException on a mismatch in strict mode.
   */
  public static boolean verify(Path actual, Path expected, Path normalizedOutput, boolean strict)
      throws IOException {
    if (!Files.isRegularFile(expected)) {
      throw MissingResourceException.forPath("Expected manifest", expected);
    }
    String normalized =
        normalize(MoreFiles.asCharSource(actual, StandardCharsets.UTF_8).read());
    MoreFiles.createParentDirectories(normalizedOutput);
    MoreFiles.asCharSink(normalizedOutput, StandardCharsets.UTF_8).write(normalized);

    String expectation =
        normalize(MoreFiles.asCharSource(expected, StandardCharsets.UTF_8).read());
    ImmutableList<String> diff =
        diff(Splitter.on('\n').splitToList(expectation), Splitter.on('\n').splitToList(normalized));
    if (diff.isEmpty()) {
      return true;
    }

    String message =
        String.format(
            "AndroidManifest.xml expectations file %s needs updating:%n%s",
            expected, Joiner.on(System.lineSeparator()).join(diff));
    if (strict) {
      throw new PolicyMismatchException("%s", message);
    }
    LOG.warn("%s", message);
    return false;
  }

  /** @return the {@code package} attribute of the manifest. */
  public static String readPackageName(Path manifest) throws IOException {
    if (!Files.isRegularFile(manifest)) {
      throw MissingResourceException.forPath("Android manifest", manifest);
    }
    Element root;
    try {
      root = XmlDomParser.parse(manifest).getDocumentElement();
    } catch (SAXException e) {
      throw new HumanReadableException(e, "Could not parse %s", manifest);
    }
    String packageName = root.getAttribute("package");
    if (packageName.isEmpty()) {
      throw new HumanReadableException("%s does not declare a package", manifest);
    }
    return packageName;
  }
}
