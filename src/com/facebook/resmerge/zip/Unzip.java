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

import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.collect.ImmutableSortedSet;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

public class Unzip {

  /** Utility class: do not instantiate. */
  private Unzip() {}

  /**
   * Extracts every file entry of {@code zipFile} under the root of {@code filesystem}.
   *
   * @return the extracted files, relative to the root of {@code filesystem}.
   */
  public static ImmutableSortedSet<Path> extractZipFile(Path zipFile, ProjectFilesystem filesystem)
      throws IOException {
    ImmutableSortedSet.Builder<Path> extracted = ImmutableSortedSet.naturalOrder();
    try (InputStream in = Files.newInputStream(zipFile);
        ZipInputStream zip = new ZipInputStream(in)) {
      for (ZipEntry entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry()) {
        Path target = filesystem.getEmptyPath().resolve(entry.getName()).normalize();
        if (target.isAbsolute() || target.startsWith("..")) {
          throw new IOException(
              String.format("Zip entry %s of %s escapes the output directory", entry, zipFile));
        }
        if (entry.isDirectory()) {
          filesystem.mkdirs(target);
          continue;
        }
        try (OutputStream out = filesystem.newFileOutputStream(target)) {
          zip.transferTo(out);
        }
        extracted.add(target);
      }
    }
    return extracted.build();
  }
}
