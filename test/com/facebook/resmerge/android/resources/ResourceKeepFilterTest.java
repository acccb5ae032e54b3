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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link ResourceKeepFilter}. */
@RunWith(JUnit4.class)
public class ResourceKeepFilterTest {

  private FileSystem fs;

  @Before
  public void setUp() {
    fs = Jimfs.newFileSystem();
  }

  private static ResourceKeepFilter blacklist(String regex, String... exceptions) {
    return new ResourceKeepFilter(
        Optional.of(Pattern.compile(regex)), ImmutableList.copyOf(exceptions));
  }

  private boolean keeps(Predicate<Path> keep, String path) {
    return keep.test(fs.getPath(path));
  }

  @Test
  public void densityConsistencyOverridesTheBlacklist() throws IOException {
    DependencyResources dependency =
        ResourceDirs.create(fs, "lib", "drawable-hdpi/unused.png", "drawable-mdpi/unused.png");

    Predicate<Path> keep =
        blacklist("hdpi/unused").createKeepPredicate(ImmutableList.of(dependency));

    assertThat(keeps(keep, "drawable-hdpi/unused.png")).isTrue();
    assertThat(keeps(keep, "drawable-mdpi/unused.png")).isTrue();
  }

  @Test
  public void drawablesBlacklistedEverywhereAreDropped() throws IOException {
    DependencyResources dependency =
        ResourceDirs.create(
            fs, "lib", "drawable-hdpi/unused.png", "drawable-mdpi/unused.png", "drawable/used.xml");

    Predicate<Path> keep = blacklist("unused").createKeepPredicate(ImmutableList.of(dependency));

    assertThat(ResourceKeepFilter.deleteRejected(ImmutableList.of(dependency), keep)).isEqualTo(2);
    assertThat(ResourceDirs.listFiles(dependency)).containsExactly("drawable/used.xml");
  }

  @Test
  public void survivingDrawablesAreTrackedAcrossDependencies() throws IOException {
    DependencyResources first = ResourceDirs.create(fs, "first", "drawable-hdpi/logo.png");
    DependencyResources second = ResourceDirs.create(fs, "second", "drawable-xxhdpi/logo.png");

    Predicate<Path> keep =
        blacklist("hdpi/logo").createKeepPredicate(ImmutableList.of(first, second));

    assertThat(keeps(keep, "drawable-hdpi/logo.png")).isFalse();
    assertThat(keeps(keep, "drawable-xxhdpi/logo.png")).isFalse();

    DependencyResources third = ResourceDirs.create(fs, "third", "drawable/logo.xml");
    keep = blacklist("hdpi/logo").createKeepPredicate(ImmutableList.of(first, second, third));
    assertThat(keeps(keep, "drawable-hdpi/logo.png")).isTrue();
  }

  @Test
  public void nonDrawablesAreFilteredIndividually() {
    Predicate<Path> keep =
        blacklist("layout-land/").createKeepPredicateForSurvivors(ImmutableSet.of("main"));

    assertThat(keeps(keep, "layout-land/main.xml")).isFalse();
    assertThat(keeps(keep, "layout/main.xml")).isTrue();
  }

  @Test
  public void mipmapsAreNeverBlacklisted() {
    Predicate<Path> keep =
        blacklist("ic_launcher").createKeepPredicateForSurvivors(ImmutableSet.of());

    assertThat(keeps(keep, "mipmap-hdpi/ic_launcher.png")).isTrue();
    assertThat(keeps(keep, "drawable-hdpi/ic_launcher.png")).isFalse();
  }

  @Test
  public void exceptionGlobsRescueBlacklistedFiles() {
    Predicate<Path> keep =
        blacklist("debug", "drawable*/debug_keep*", "values/*")
            .createKeepPredicateForSurvivors(ImmutableSet.of());

    assertThat(keeps(keep, "drawable-hdpi/debug_keep_icon.png")).isTrue();
    assertThat(keeps(keep, "values/debug.xml")).isTrue();
    assertThat(keeps(keep, "raw/debug.json")).isFalse();
  }

  @Test
  public void dotFilesAreAlwaysDropped() {
    Predicate<Path> keepAll =
        ResourceKeepFilter.keepAll().createKeepPredicateForSurvivors(ImmutableSet.of());
    Predicate<Path> keepSome =
        blacklist("nothing").createKeepPredicateForSurvivors(ImmutableSet.of(".gitkeep"));

    assertThat(keeps(keepAll, "drawable/.gitkeep")).isFalse();
    assertThat(keeps(keepSome, "drawable/.gitkeep")).isFalse();
    assertThat(keeps(keepAll, "drawable/icon.png")).isTrue();
  }

  @Test
  public void withoutBlacklistOnlyDotFilesAreDeleted() throws IOException {
    DependencyResources dependency =
        ResourceDirs.create(fs, "lib", "drawable/.DS_Store", "drawable/icon.png", "raw/data.bin");

    Predicate<Path> keep =
        ResourceKeepFilter.keepAll().createKeepPredicate(ImmutableList.of(dependency));
    ResourceKeepFilter.deleteRejected(ImmutableList.of(dependency), keep);

    assertThat(ResourceDirs.listFiles(dependency))
        .containsExactly("drawable/icon.png", "raw/data.bin");
  }
}
