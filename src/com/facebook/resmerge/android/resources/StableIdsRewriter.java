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

import com.facebook.resmerge.core.exceptions.MissingResourceException;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adapts a file written by {@code aapt2 link --emit-ids} to another package.
 *
 * <p>{@code --stable-ids} is meant for different versions of the same package, so each {@code
 * package:type/name = 0x...} line gets the package being linked. The package ID in the file must
 * still match the one being linked.
 */
public class StableIdsRewriter {

  private static final Pattern PACKAGE_PREFIX = Pattern.compile("^.*?:", Pattern.MULTILINE);

  /** Utility class: do not instantiate. */
  private StableIdsRewriter() {}

  public static String rewrite(String stableIds, String packageName) {
    return PACKAGE_PREFIX
        .matcher(stableIds)
        .replaceAll(Matcher.quoteReplacement(packageName + ":"));
  }

  public static void rewrite(Path input, Path output, String packageName) throws IOException {
    if (!Files.isRegularFile(input)) {
      throw MissingResourceException.forPath("Stable IDs file", input);
    }
    String rewritten =
        rewrite(MoreFiles.asCharSource(input, StandardCharsets.UTF_8).read(), packageName);
    MoreFiles.asCharSink(output, StandardCharsets.UTF_8).write(rewritten);
  }
}
