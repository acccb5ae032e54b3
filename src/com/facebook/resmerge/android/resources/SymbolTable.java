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
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The resource symbols listed in an {@code R.txt} file, e.g. {@code int string app_name
 * 0x7f0c001b}. Only the type and name of each symbol are kept.
 */
public class SymbolTable {

  private static final Splitter WHITESPACE_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().limit(4);

  /** Symbol types whose values live in {@code values-*} string files. */
  static final ImmutableSet<String> STRING_TYPES = ImmutableSet.of("string", "plurals", "array");

  private final ImmutableSetMultimap<String, String> namesByType;

  private SymbolTable(ImmutableSetMultimap<String, String> namesByType) {
    this.namesByType = namesByType;
  }

  public static SymbolTable parse(Iterable<String> lines) {
    ImmutableSetMultimap.Builder<String, String> namesByType = ImmutableSetMultimap.builder();
    for (String line : lines) {
      List<String> parts = WHITESPACE_SPLITTER.splitToList(line);
      // Arrays (int[] styleable ...) do not name individual resources.
      if (parts.size() < 3 || !parts.get(0).equals("int")) {
        continue;
      }
      namesByType.put(parts.get(1), parts.get(2));
    }
    return new SymbolTable(namesByType.build());
  }

  /** @throws MissingResourceException if {@code rDotTxt} does not exist. */
  public static SymbolTable read(Path rDotTxt) throws IOException {
    if (!Files.isRegularFile(rDotTxt)) {
      throw MissingResourceException.forPath("Symbol table", rDotTxt);
    }
    return parse(MoreFiles.asCharSource(rDotTxt, StandardCharsets.UTF_8).readLines());
  }

  public ImmutableSet<String> getNames(String type) {
    return namesByType.get(type);
  }

  /** Names of the string, plurals and string-array resources. */
  public ImmutableSortedSet<String> getStringResourceNames() {
    ImmutableSortedSet.Builder<String> names = ImmutableSortedSet.naturalOrder();
    for (String type : STRING_TYPES) {
      names.addAll(namesByType.get(type));
    }
    return names.build();
  }

  /** Names of the {@code id} resources, which UI tests look views up by. */
  public ImmutableSortedSet<String> getIdNames() {
    return ImmutableSortedSet.copyOf(namesByType.get("id"));
  }
}
