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

import com.google.common.base.Preconditions;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class MorePaths {

  /** Utility class: do not instantiate. */
  private MorePaths() {}

  public static String pathWithUnixSeparators(Path path) {
    return path.toString().replace("\\", "/");
  }

  /**
   * Get a relative path from path1 to path2, first normalizing each path.
   *
   * <p>This method is a workaround for JDK-6925169 (Path.relativize returns incorrect result if
   * path contains "." or "..").
   */
  public static Path relativize(Path path1, Path path2) {
    Path emptyPath = path1.getFileSystem().getPath("");

    Preconditions.checkArgument(
        path1.isAbsolute() == path2.isAbsolute(),
        "Both paths must be absolute or both paths must be relative. (%s is %s, %s is %s)",
        path1,
        path1.isAbsolute() ? "absolute" : "relative",
        path2,
        path2.isAbsolute() ? "absolute" : "relative");

    if (!path1.equals(emptyPath)) {
      path1 = path1.normalize();
    }
    if (!path2.equals(emptyPath)) {
      path2 = path2.normalize();
    }

    if (path1.equals(emptyPath)) {
      return path2;
    }
    return path1.relativize(path2);
  }

  /**
   * Returns the file name of {@code path} up to its first dot, e.g. {@code icon} for both {@code
   * drawable/icon.png} and {@code drawable/icon.9.png}.
   */
  public static String getNameWithoutExtensions(Path path) {
    String fileName = path.getFileName().toString();
    int dot = fileName.indexOf('.');
    return dot < 0 ? fileName : fileName.substring(0, dot);
  }

  public static String getFileExtension(Path path) {
    return com.google.common.io.Files.getFileExtension(path.getFileName().toString());
  }

  /** @return true if {@code path} is missing or its bytes differ from {@code contents}. */
  public static boolean fileContentsDiffer(ByteSource contents, Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      return true;
    }
    HashCode existing = com.google.common.io.MoreFiles.asByteSource(path).hash(Hashing.sha256());
    return !existing.equals(contents.hash(Hashing.sha256()));
  }
}
