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

import com.google.common.collect.ImmutableList;
import java.nio.file.Paths;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class GlobPatternMatcherTest {

  @Test
  public void starsCrossDirectories() {
    GlobPatternMatcher matcher = new GlobPatternMatcher("*icon*");

    assertThat(matcher.matches("drawable-hdpi/icon.png")).isTrue();
    assertThat(matcher.matches("drawable/logo.png")).isFalse();
  }

  @Test
  public void wholePathMustMatch() {
    GlobPatternMatcher matcher = new GlobPatternMatcher("drawable/*.png");

    assertThat(matcher.matches("drawable/a.png")).isTrue();
    assertThat(matcher.matches("res/drawable/a.png")).isFalse();
    assertThat(matcher.matches("drawable/a.png.bak")).isFalse();
  }

  @Test
  public void questionMarksAndCharacterClasses() {
    assertThat(new GlobPatternMatcher("values-??/*").matches("values-fr/strings.xml")).isTrue();
    assertThat(new GlobPatternMatcher("values-??/*").matches("values-fil/strings.xml")).isFalse();
    assertThat(new GlobPatternMatcher("drawable-[hm]dpi/*").matches("drawable-mdpi/a.png"))
        .isTrue();
    assertThat(new GlobPatternMatcher("drawable-[!hm]dpi/*").matches("drawable-mdpi/a.png"))
        .isFalse();
  }

  @Test
  public void regexCharactersAreLiteral() {
    assertThat(new GlobPatternMatcher("a+b.(c)").matches("a+b.(c)")).isTrue();
    assertThat(new GlobPatternMatcher("a+b.(c)").matches("aab.(c)")).isFalse();
  }

  @Test
  public void matchesAny() {
    ImmutableList<GlobPatternMatcher> matchers =
        GlobPatternMatcher.of(ImmutableList.of("raw/*", "*.9.png"));

    assertThat(GlobPatternMatcher.matchesAny(matchers, Paths.get("raw", "data.bin"))).isTrue();
    assertThat(GlobPatternMatcher.matchesAny(matchers, Paths.get("drawable", "b.9.png"))).isTrue();
    assertThat(GlobPatternMatcher.matchesAny(matchers, Paths.get("drawable", "b.png"))).isFalse();
    assertThat(GlobPatternMatcher.matchesAny(ImmutableList.of(), Paths.get("a"))).isFalse();
  }
}
