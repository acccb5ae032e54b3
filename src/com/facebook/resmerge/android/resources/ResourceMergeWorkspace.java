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

import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.facebook.resmerge.core.exceptions.MissingResourceException;
import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.io.ProjectFilesystem;
import com.facebook.resmerge.zip.Unzip;
import com.google.common.collect.ImmutableList;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * The scratch directory of one merge run. Dependencies are extracted under {@code deps/}, compiled
 * partials go to {@code partials/}, and every output is first written here.
 *
 * <p>A temporary workspace is deleted on {@link #close()}. A debug workspace lives at a fixed
 * location, is emptied when created and is kept afterwards for inspection.
 */
public class ResourceMergeWorkspace implements Closeable {

  private static final Logger LOG = Logger.get(ResourceMergeWorkspace.class);

  private final ProjectFilesystem filesystem;
  private final boolean keep;

  private ResourceMergeWorkspace(ProjectFilesystem filesystem, boolean keep) {
    this.filesystem = filesystem;
    this.keep = keep;
  }

  /**
   * @param debugRoot if present, the workspace is {@code <debugRoot>/<name>} and survives the run.
   */
  public static ResourceMergeWorkspace create(Optional<Path> debugRoot, String name)
      throws IOException {
    if (debugRoot.isPresent()) {
      ProjectFilesystem filesystem =
          new ProjectFilesystem(debugRoot.get().resolve(name).toAbsolutePath());
      filesystem.deleteRecursivelyIfExists(filesystem.getEmptyPath());
      filesystem.mkdirs(filesystem.getEmptyPath());
      LOG.info("Keeping intermediate resources in %s", filesystem.getRootPath());
      return new ResourceMergeWorkspace(filesystem, true);
    }
    Path temp = Files.createTempDirectory("resmerge");
    return new ResourceMergeWorkspace(new ProjectFilesystem(temp.toAbsolutePath()), false);
  }

  /** A workspace at an existing directory, deleted on close unless {@code keep}. */
  public static ResourceMergeWorkspace at(Path root, boolean keep) {
    return new ResourceMergeWorkspace(new ProjectFilesystem(root), keep);
  }

  public ProjectFilesystem getFilesystem() {
    return filesystem;
  }

  public Path getRoot() {
    return filesystem.getRootPath();
  }

  public Path getDepsDir() {
    return getRoot().resolve("deps");
  }

  public Path getPartialsDir() {
    return getRoot().resolve("partials");
  }

  public Path getArscPath() {
    return getRoot().resolve("arsc.ap_");
  }

  public Path getProtoPath() {
    return getRoot().resolve("proto.ap_");
  }

  public Path getOptimizedArscPath() {
    return getRoot().resolve("optimized.arsc.ap_");
  }

  public Path getOptimizedProtoPath() {
    return getRoot().resolve("optimized.proto.ap_");
  }

  public Path getInfoPath() {
    return getRoot().resolve("size.info");
  }

  public Path getRTextPath() {
    return getRoot().resolve("R.txt");
  }

  public Path getProguardPath() {
    return getRoot().resolve("keep.proguard.txt");
  }

  public Path getProguardMainDexPath() {
    return getRoot().resolve("maindex.proguard.txt");
  }

  public Path getEmitIdsPath() {
    return getRoot().resolve("emit_ids.txt");
  }

  public Path getStableIdsPath() {
    return getRoot().resolve("stable_ids.txt");
  }

  public Path getResourcesConfigPath() {
    return getRoot().resolve("aapt2.config");
  }

  public Path getResourcesPathMapPath() {
    return getRoot().resolve("resources_path_map.txt");
  }

  public Path getNormalizedManifestPath() {
    return getRoot().resolve("AndroidManifest.normalized.xml");
  }

  /**
   * Extracts each archive into {@code deps/<archive file name>}.
   *
   * @throws MissingResourceException if an archive does not exist.
   * @throws HumanReadableException if two archives have the same file name.
   */
  public ImmutableList<DependencyResources> extractDependencies(Iterable<Path> archives)
      throws IOException {
    Set<String> names = new HashSet<>();
    ImmutableList.Builder<DependencyResources> dependencies = ImmutableList.builder();
    for (Path archive : archives) {
      if (!Files.isRegularFile(archive)) {
        throw MissingResourceException.forPath("Dependency resource archive", archive);
      }
      String name = archive.getFileName().toString();
      if (!names.add(name)) {
        throw new HumanReadableException(
            "Resource archive names must be unique: %s appears more than once", name);
      }
      ProjectFilesystem dependencyFilesystem = new ProjectFilesystem(getDepsDir().resolve(name));
      dependencyFilesystem.mkdirs(dependencyFilesystem.getEmptyPath());
      Unzip.extractZipFile(archive, dependencyFilesystem);
      dependencies.add(new DependencyResources(name, Optional.of(archive), dependencyFilesystem));
    }
    return dependencies.build();
  }

  @Override
  public void close() throws IOException {
    if (keep) {
      return;
    }
    filesystem.deleteRecursivelyIfExists(filesystem.getEmptyPath());
  }
}
