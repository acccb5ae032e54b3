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

import com.facebook.resmerge.io.ProjectFilesystem;
import com.google.common.base.MoreObjects;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The extracted resource directory of one dependency, together with the renames applied to it so
 * far. Every path handed to or returned by this class is relative to the resource directory.
 */
public class DependencyResources {

  private final String name;
  private final Optional<Path> archive;
  private final ProjectFilesystem filesystem;
  private final RenameLedger ledger;

  public DependencyResources(String name, Optional<Path> archive, ProjectFilesystem filesystem) {
    this.name = name;
    this.archive = archive;
    this.filesystem = filesystem;
    this.ledger = new RenameLedger();
  }

  /** For resource directories that do not come from an archive, e.g. in tests. */
  public static DependencyResources of(String name, Path resourceRoot) {
    return new DependencyResources(name, Optional.empty(), new ProjectFilesystem(resourceRoot));
  }

  /** The archive file name, which is also the name of the extracted directory. */
  public String getName() {
    return name;
  }

  public Optional<Path> getArchive() {
    return archive;
  }

  public ProjectFilesystem getFilesystem() {
    return filesystem;
  }

  public Path getResourceRoot() {
    return filesystem.getRootPath();
  }

  public RenameLedger getLedger() {
    return ledger;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("root", filesystem.getRootPath())
        .toString();
  }
}
