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

package com.facebook.resmerge.android.resources.cli;

import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses list arguments written the way GN passes them, e.g. {@code ["en-US", "fr"]}. */
class GnLists {

  private static final Pattern QUOTED = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");

  /** Utility class: do not instantiate. */
  private GnLists() {}

  /**
   * Parses a GN list. {@code null} and blank strings are empty lists, and a string that is not a
   * list at all is a list of one element.
   */
  static ImmutableList<String> parse(String value) {
    if (value == null || value.trim().isEmpty()) {
      return ImmutableList.of();
    }
    String trimmed = value.trim();
    if (!trimmed.startsWith("[")) {
      return ImmutableList.of(trimmed);
    }
    if (!trimmed.endsWith("]")) {
      throw new HumanReadableException("Malformed list: %s", value);
    }
    ImmutableList.Builder<String> elements = ImmutableList.builder();
    Matcher matcher = QUOTED.matcher(trimmed.substring(1, trimmed.length() - 1));
    while (matcher.find()) {
      elements.add(matcher.group(1).replaceAll("\\\\(.)", "$1"));
    }
    return elements.build();
  }

  /** Parses a GN list of {@code name=0x7f} entries. */
  static ImmutableMap<String, Integer> parsePackageIds(String value) {
    ImmutableMap.Builder<String, Integer> ids = ImmutableMap.builder();
    for (String entry : parse(value)) {
      List<String> parts = Splitter.on('=').limit(2).trimResults().splitToList(entry);
      if (parts.size() != 2) {
        throw new HumanReadableException("Expected <package name>=<package id>, got %s", entry);
      }
      try {
        ids.put(parts.get(0), Integer.decode(parts.get(1)));
      } catch (NumberFormatException e) {
        throw new HumanReadableException(e, "Invalid package ID in %s", entry);
      }
    }
    return ids.build();
  }
}
