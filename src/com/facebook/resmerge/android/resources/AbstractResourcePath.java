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

import com.facebook.resmerge.core.util.immutables.ResMergeStyleImmutable;
import com.facebook.resmerge.io.MorePaths;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A file path relative to the root of a resource directory, broken down into the resource type and
 * qualifiers of its directory ({@code drawable-hdpi-v4}) and its file name ({@code icon.png}).
 * Paths that do not have this shape, or whose type is unknown, are ungoverned: they have no type
 * and every transform leaves them alone.
 */
@Value.Immutable
@ResMergeStyleImmutable
abstract class AbstractResourcePath {

  public abstract Path getPath();

  /** e.g. {@code drawable} for {@code drawable-hdpi-v4/icon.png}. */
  public abstract Optional<String> getType();

  /** e.g. {@code [hdpi, v4]} for {@code drawable-hdpi-v4/icon.png}. */
  public abstract ImmutableList<String> getQualifiers();

  public String getFileName() {
    return getPath().getFileName().toString();
  }

  /** The name resources are referenced by: the file name up to its first dot. */
  public String getName() {
    return MorePaths.getNameWithoutExtensions(getPath());
  }

  public String getExtension() {
    return MorePaths.getFileExtension(getPath());
  }

  public boolean isGoverned() {
    return getType().isPresent();
  }

  public boolean isDotFile() {
    return getFileName().startsWith(".");
  }

  /** drawables and mipmaps. */
  public boolean isImageResource() {
    return getType().filter(PathClassifier.IMAGE_RESOURCE_TYPES::contains).isPresent();
  }

  public boolean isDrawable() {
    return getType().filter(PathClassifier.DRAWABLE::equals).isPresent();
  }

  public boolean isMipmap() {
    return getType().filter(PathClassifier.MIPMAP::equals).isPresent();
  }

  /** The first density qualifier of the directory, if any. */
  @Value.Lazy
  public Optional<Density> getDensity() {
    for (String qualifier : getQualifiers()) {
      Optional<Density> density = Density.fromQualifier(qualifier);
      if (density.isPresent()) {
        return density;
      }
    }
    return Optional.empty();
  }

  /**
   * The locale qualifier as spelled in the directory name, for string resource files such as
   * {@code values-zh-rTW/strings.xml}. Directories combining a locale with other qualifiers ({@code
   * values-fr-v21}) do not count.
   */
  @Value.Lazy
  public Optional<String> getStringLocaleQualifier() {
    if (!getType().filter(PathClassifier.VALUES::equals).isPresent()
        || getQualifiers().isEmpty()
        || !getExtension().equals("xml")) {
      return Optional.empty();
    }
    String suffix = Joiner.on('-').join(getQualifiers());
    if (PathClassifier.NON_LOCALE_QUALIFIERS.contains(suffix)) {
      return Optional.empty();
    }
    if (LocaleQualifier.fromAndroidQualifier(suffix).isPresent()) {
      return Optional.of(suffix);
    }
    return Optional.empty();
  }

  @Value.Lazy
  public Optional<LocaleQualifier> getStringLocale() {
    return getStringLocaleQualifier().flatMap(LocaleQualifier::fromAndroidQualifier);
  }

  /** @return the same file name under a sibling directory with the given qualifiers. */
  public Path withQualifiers(ImmutableList<String> qualifiers) {
    String directory =
        Joiner.on('-')
            .join(ImmutableList.<String>builder().add(getType().get()).addAll(qualifiers).build());
    return getPath().getFileSystem().getPath(directory, getFileName());
  }
}
