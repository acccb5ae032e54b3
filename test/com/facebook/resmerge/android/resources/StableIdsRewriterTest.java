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
import static org.junit.Assert.assertThrows;

import com.facebook.resmerge.core.exceptions.MissingResourceException;
import com.google.common.jimfs.Jimfs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StableIdsRewriterTest {

  @Test
  public void replacesThePackageOfEveryLine() {
    assertThat(
            StableIdsRewriter.rewrite(
                "org.base:string/app_name = 0x7f0c0001\norg.base:id/title = 0x7f0b0002\n",
                "org.feature"))
        .isEqualTo("org.feature:string/app_name = 0x7f0c0001\norg.feature:id/title = 0x7f0b0002\n");
  }

  @Test
  public void rewritesFiles() throws IOException {
    FileSystem fs = Jimfs.newFileSystem();
    Path input = fs.getPath("/ids.txt");
    Path output = fs.getPath("/stable.txt");
    Files.write(input, "a:layout/main = 0x7f0a0000\n".getBytes(StandardCharsets.UTF_8));

    StableIdsRewriter.rewrite(input, output, "b$c");

    assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8))
        .isEqualTo("b$c:layout/main = 0x7f0a0000\n");
    assertThrows(
        MissingResourceException.class,
        () -> StableIdsRewriter.rewrite(fs.getPath("/missing.txt"), output, "b"));
  }
}
