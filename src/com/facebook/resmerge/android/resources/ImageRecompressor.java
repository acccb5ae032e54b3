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

import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.io.MorePaths;
import com.facebook.resmerge.io.ProjectFilesystem;
import com.facebook.resmerge.step.DefaultStepRunner;
import com.facebook.resmerge.step.StepFailedException;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Replaces the PNG drawables and mipmaps of each dependency with lossless WebP versions.
 *
 * <p>Conversions run in parallel on the given executor. The PNGs are only deleted, and the renames
 * only recorded, once every conversion has succeeded.
 */
public class ImageRecompressor {

  private static final Logger LOG = Logger.get(ImageRecompressor.class);

  /** Images that must stay PNG. */
  static final Pattern EXCLUDED_IMAGES =
      Pattern.compile(
          String.join(
              "|",
              // Crashes on Galaxy S5 running L (https://crbug.com/671604).
              ".*star_gray\\.png",
              // Android requires 9-patches to be PNGs.
              ".*\\.9\\.png",
              // Daydream requires these to be PNGs (https://crbug.com/800738).
              ".*daydream_icon_.*\\.png"));

  private final Path cwebp;

  public ImageRecompressor(Path cwebp) {
    this.cwebp = cwebp;
  }

  static boolean isCandidate(Path pathRelativeToResourceRoot) {
    ResourcePath resourcePath = PathClassifier.classify(pathRelativeToResourceRoot);
    return resourcePath.isImageResource()
        && resourcePath.getExtension().equals("png")
        && !EXCLUDED_IMAGES
            .matcher(MorePaths.pathWithUnixSeparators(pathRelativeToResourceRoot))
            .matches();
  }

  /**
   * Converts every candidate image of {@code dependencies}.
   *
   * @return the number of converted images.
   */
  public int recompress(
      Iterable<DependencyResources> dependencies,
      DefaultStepRunner stepRunner,
      ListeningExecutorService executorService)
      throws IOException, StepFailedException, InterruptedException {
    ImmutableList.Builder<Conversion> builder = ImmutableList.builder();
    for (DependencyResources dependency : dependencies) {
      ProjectFilesystem filesystem = dependency.getFilesystem();
      for (Path png :
          filesystem.getFilesUnderPath(
              filesystem.getEmptyPath(), ImageRecompressor::isCandidate)) {
        Path webp = png.resolveSibling(MorePaths.getNameWithoutExtensions(png) + ".webp");
        builder.add(
            new Conversion(
                dependency,
                png,
                webp,
                new WebpConversionStep(cwebp, filesystem.resolve(png), filesystem.resolve(webp))));
      }
    }
    ImmutableList<Conversion> conversions = builder.build();
    if (conversions.isEmpty()) {
      return 0;
    }

    ImmutableList.Builder<WebpConversionStep> steps = ImmutableList.builder();
    conversions.forEach(conversion -> steps.add(conversion.step));
    stepRunner.runStepsInParallelAndWait(steps.build(), executorService);

    for (Conversion conversion : conversions) {
      conversion.dependency.getFilesystem().deleteFileAtPath(conversion.png);
      conversion.dependency.getLedger().recordMove(conversion.webp, conversion.png);
    }
    LOG.info("Converted %d images to WebP", conversions.size());
    return conversions.size();
  }

  private static class Conversion {
    final DependencyResources dependency;
    final Path png;
    final Path webp;
    final WebpConversionStep step;

    Conversion(DependencyResources dependency, Path png, Path webp, WebpConversionStep step) {
      this.dependency = dependency;
      this.png = png;
      this.webp = webp;
      this.step = step;
    }
  }
}
