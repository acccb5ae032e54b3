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

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Matches whole unix-style path strings against a shell glob. Unlike {@link
 * java.nio.file.PathMatcher} globs, {@code *} and {@code ?} also match {@code /}, so {@code
 * *icon*} matches {@code drawable-hdpi/icon.png}.
 */
public class GlobPatternMatcher {

  private final String globPattern;
  private final Pattern pattern;

  public GlobPatternMatcher(String globPattern) {
    this.globPattern = globPattern;
    this.pattern = Pattern.compile(toRegex(globPattern), Pattern.DOTALL);
  }

  public static ImmutableList<GlobPatternMatcher> of(Iterable<String> globPatterns) {
    ImmutableList.Builder<GlobPatternMatcher> matchers = ImmutableList.builder();
    for (String glob : globPatterns) {
      matchers.add(new GlobPatternMatcher(glob));
    }
    return matchers.build();
  }

  public static boolean matchesAny(Iterable<GlobPatternMatcher> matchers, Path path) {
    String unixPath = MorePaths.pathWithUnixSeparators(path);
    for (GlobPatternMatcher matcher : matchers) {
      if (matcher.matches(unixPath)) {
        return true;
      }
    }
    return false;
  }

  public boolean matches(String unixPath) {
    return pattern.matcher(unixPath).matches();
  }

  public String getGlobPattern() {
    return globPattern;
  }

  private static String toRegex(String glob) {
    StringBuilder regex = new StringBuilder();
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i++);
      switch (c) {
        case '*':
          regex.append(".*");
          break;
        case '?':
          regex.append('.');
          break;
        case '[':
          int close = glob.indexOf(']', i + 1);
          if (close < 0) {
            regex.append("\\[");
            break;
          }
          String body = glob.substring(i, close);
          i = close + 1;
          regex.append('[');
          if (body.startsWith("!")) {
            regex.append('^');
            body = body.substring(1);
          }
          regex.append(body.replace("\\", "\\\\").replace("[", "\\["));
          regex.append(']');
          break;
        default:
          regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return regex.toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof GlobPatternMatcher)) {
      return false;
    }
    return Objects.equals(globPattern, ((GlobPatternMatcher) other).globPattern);
  }

  @Override
  public int hashCode() {
    return globPattern.hashCode();
  }

  @Override
  public String toString() {
    return "GlobPatternMatcher{" + globPattern + "}";
  }
}
