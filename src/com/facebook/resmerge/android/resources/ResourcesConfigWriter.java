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
import java.util.Optional;

/**
 * Writes the resources config for {@code aapt2 optimize} when resource names are obfuscated.
 *
 * <p>{@code id} resources name views that UI automation looks up, so they keep their names even if
 * nothing references them at runtime (https://crbug.com/900993).
 */
public class ResourcesConfigWriter {

  static final String NO_OBFUSCATE = "#no_obfuscate";

  /** Utility class: do not instantiate. */
  private ResourcesConfigWriter() {}

  public static String createConfig(String baseConfig, SymbolTable symbols) {
    StringBuilder config = new StringBuilder(baseConfig);
    if (config.length() > 0 && config.charAt(config.length() - 1) != '\n') {
      config.append('\n');
    }
    for (String id : symbols.getIdNames()) {
      config.append("id/").append(id).append(NO_OBFUSCATE).append('\n');
    }
    return config.toString();
  }

  public static void write(Optional<Path> baseConfig, Path rDotTxt, Path output)
      throws IOException {
    String base = "";
    if (baseConfig.isPresent()) {
      if (!Files.isRegularFile(baseConfig.get())) {
        throw MissingResourceException.forPath("Resources config", baseConfig.get());
      }
      base = MoreFiles.asCharSource(baseConfig.get(), StandardCharsets.UTF_8).read();
    }
    MoreFiles.asCharSink(output, StandardCharsets.UTF_8)
        .write(createConfig(base, SymbolTable.read(rDotTxt)));
  }
}
