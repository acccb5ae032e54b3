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
import static com.google.common.truth.Truth8.assertThat;
import static org.junit.Assert.assertThrows;

import com.facebook.resmerge.core.exceptions.ConfigurationContradictionException;
import com.google.common.collect.ImmutableList;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.file.FileSystem;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PlatformDuplicatorTest {

  private FileSystem fs;
  private PlatformDuplicator duplicator;

  @Before
  public void setUp() {
    fs = Jimfs.newFileSystem();
    duplicator = PlatformDuplicator.createDefault();
  }

  @Test
  public void copiesTaiwaneseResourcesToHongKong() throws IOException {
    DependencyResources dependency =
        ResourceDirs.create(
            fs,
            "lib",
            "values-zh-rTW/strings.xml",
            "drawable-zh-rTW-hdpi/flag.png",
            "values-zh/strings.xml",
            "values/strings.xml");

    duplicator.duplicate(dependency);

    assertThat(ResourceDirs.listFiles(dependency))
        .containsExactly(
            "drawable-zh-rHK-hdpi/flag.png",
            "drawable-zh-rTW-hdpi/flag.png",
            "values-zh-rHK/strings.xml",
            "values-zh-rTW/strings.xml",
            "values-zh/strings.xml",
            "values/strings.xml");
    assertThat(ResourceDirs.read(dependency, "values-zh-rHK/strings.xml"))
        .isEqualTo("values-zh-rTW/strings.xml");
    assertThat(dependency.getLedger().getOriginalPath(fs.getPath("drawable-zh-rHK-hdpi/flag.png")))
        .hasValue(fs.getPath("drawable-zh-rTW-hdpi/flag.png"));
  }

  @Test
  public void existingTargetIsKept() throws IOException {
    DependencyResources dependency =
        ResourceDirs.create(fs, "lib", "values-zh-rTW/strings.xml", "values-zh-rHK/strings.xml");

    assertThat(duplicator.duplicate(dependency)).isEmpty();
    assertThat(ResourceDirs.read(dependency, "values-zh-rHK/strings.xml"))
        .isEqualTo("values-zh-rHK/strings.xml");
    assertThat(dependency.getLedger().isEmpty()).isTrue();
  }

  @Test
  public void ungovernedPathsAreIgnored() {
    assertThat(
            duplicator.planCopies(
                ImmutableList.of(
                    fs.getPath("values-zh-rTW/nested/strings.xml"),
                    fs.getPath("values-zh-rTWN/strings.xml"))))
        .isEmpty();
  }

  @Test
  public void requestingTheTargetIsAContradiction() {
    duplicator.checkTargetNotRequested(ImmutableList.of(LocaleQualifier.of("zh", "TW")));
    assertThrows(
        ConfigurationContradictionException.class,
        () ->
            duplicator.checkTargetNotRequested(
                ImmutableList.of(LocaleQualifier.of("en"), LocaleQualifier.of("zh", "HK"))));
  }
}
