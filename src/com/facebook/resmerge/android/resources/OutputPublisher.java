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
import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.io.MorePaths;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Moves the outputs of a run from the workspace to their final locations once everything else has
 * succeeded. A final file whose content would not change is left untouched, so its timestamp does
 * not trigger downstream work.
 */
public class OutputPublisher {

  private static final Logger LOG = Logger.get(OutputPublisher.class);

  private final Map<Path, Path> finalToTemporary = new LinkedHashMap<>();

  /** Registers an output, if it was requested. */
  public OutputPublisher add(Path temporary, Optional<Path> finalPath) {
    finalPath.ifPresent(path -> finalToTemporary.put(path, temporary));
    return this;
  }

  public ImmutableMap<Path, Path> getOutputs() {
    return ImmutableMap.copyOf(finalToTemporary);
  }

  /**
   * Publishes every registered output. Nothing is moved unless every temporary file exists.
   *
   * @return the number of outputs actually written.
   */
  public int publish() throws IOException {
    for (Map.Entry<Path, Path> output : finalToTemporary.entrySet()) {
      if (!Files.isRegularFile(output.getValue())) {
        throw MissingResourceException.forPath(
            String.format("Output for %s", output.getKey()), output.getValue());
      }
    }

    int written = 0;
    for (Map.Entry<Path, Path> output : finalToTemporary.entrySet()) {
      Path finalPath = output.getKey();
      Path temporary = output.getValue();
      if (!MorePaths.fileContentsDiffer(MoreFiles.asByteSource(temporary), finalPath)) {
        LOG.debug("%s is up to date", finalPath);
        continue;
      }
      MoreFiles.createParentDirectories(finalPath);
      Files.move(temporary, finalPath, StandardCopyOption.REPLACE_EXISTING);
      written++;
    }
    LOG.info("Published %d of %d outputs", written, finalToTemporary.size());
    return written;
  }
}
