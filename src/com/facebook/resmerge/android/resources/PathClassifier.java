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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses resource-relative paths into {@link ResourcePath}s. Classification is total: every path
 * yields a {@link ResourcePath}, ungoverned unless it is a file directly inside a
 * directory named after a known resource type, optionally followed by dash-separated qualifiers.
 */
public class PathClassifier {

  static final String DRAWABLE = "drawable";
  static final String MIPMAP = "mipmap";
  static final String VALUES = "values";

  /** Qualifiers that look like a language code but are not. */
  static final ImmutableSet<String> NON_LOCALE_QUALIFIERS = ImmutableSet.of("car");

  static final ImmutableSet<String> IMAGE_RESOURCE_TYPES = ImmutableSet.of(DRAWABLE, MIPMAP);

  /**
   * The set of supported directories in resource folders. This is defined in
   * http://developer.android.com/guide/topics/resources/providing-resources.html#table1
   */
  public static final ImmutableSet<String> SUPPORTED_RESOURCE_DIRECTORIES =
      ImmutableSet.of(
          "animator",
          "anim",
          "color",
          DRAWABLE,
          "font",
          MIPMAP,
          "layout",
          "menu",
          "raw",
          VALUES,
          "xml",
          // Not in the table above, but several support libraries use it.
          "interpolator",
          "transition");

  /** Utility class: do not instantiate. */
  private PathClassifier() {}

  public static ResourcePath classify(Path pathRelativeToResourceRoot) {
    ResourcePath.Builder builder = ResourcePath.builder().setPath(pathRelativeToResourceRoot);
    if (pathRelativeToResourceRoot.isAbsolute()
        || pathRelativeToResourceRoot.getNameCount() != 2) {
      return builder.build();
    }
    List<String> parts =
        Splitter.on('-').splitToList(pathRelativeToResourceRoot.getName(0).toString());
    if (!SUPPORTED_RESOURCE_DIRECTORIES.contains(parts.get(0))) {
      return builder.build();
    }
    return builder
        .setType(parts.get(0))
        .addAllQualifiers(ImmutableList.copyOf(parts.subList(1, parts.size())))
        .build();
  }
}
