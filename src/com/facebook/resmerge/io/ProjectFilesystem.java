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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * An injectable service for interacting with the filesystem relative to a root directory. The root
 * may live on any NIO {@link java.nio.file.FileSystem}, which lets tests run against an in-memory
 * filesystem.
 *
 * <p>All {@code Path} arguments are relative to the root unless stated otherwise, and every
 * listing is returned in sorted order so that callers iterate deterministically.
 */
public class ProjectFilesystem {

  private final Path projectRoot;

  public ProjectFilesystem(Path root) {
    Preconditions.checkArgument(root.isAbsolute(), "Root must be absolute: %s", root);
    this.projectRoot = root.normalize();
  }

  public final Path getRootPath() {
    return projectRoot;
  }

  /** @return the empty path, which resolves to the root itself. */
  public Path getEmptyPath() {
    return projectRoot.getFileSystem().getPath("");
  }

  public Path resolve(Path path) {
    return projectRoot.resolve(path);
  }

  public Path resolve(String path) {
    return projectRoot.resolve(path);
  }

  /** Converts an absolute path under the root to a root-relative one. */
  public Path relativize(Path absolutePath) {
    return MorePaths.relativize(projectRoot, absolutePath);
  }

  public boolean exists(Path pathRelativeToProjectRoot) {
    return Files.exists(resolve(pathRelativeToProjectRoot));
  }

  public boolean isDirectory(Path pathRelativeToProjectRoot) {
    return Files.isDirectory(resolve(pathRelativeToProjectRoot));
  }

  /**
   * Similar to {@link Files#walkFileTree(Path, FileVisitor)} except this takes in and hands out
   * paths relative to the project root.
   */
  public void walkRelativeFileTree(
      Path pathRelativeToProjectRoot, final FileVisitor<Path> fileVisitor) throws IOException {
    FileVisitor<Path> relativizingVisitor =
        new FileVisitor<Path>() {
          @Override
          public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
              throws IOException {
            return fileVisitor.preVisitDirectory(relativize(dir), attrs);
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
              throws IOException {
            return fileVisitor.visitFile(relativize(file), attrs);
          }

          @Override
          public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            return fileVisitor.visitFileFailed(relativize(file), exc);
          }

          @Override
          public FileVisitResult postVisitDirectory(Path dir, IOException exc)
              throws IOException {
            return fileVisitor.postVisitDirectory(relativize(dir), exc);
          }
        };

    Files.walkFileTree(
        resolve(pathRelativeToProjectRoot),
        EnumSet.of(FileVisitOption.FOLLOW_LINKS),
        Integer.MAX_VALUE,
        relativizingVisitor);
  }

  /** @return every regular file under the root, relative to the root, in sorted order. */
  public ImmutableSortedSet<Path> getFilesUnderRoot() throws IOException {
    return getFilesUnderPath(getEmptyPath(), path -> true);
  }

  public ImmutableSortedSet<Path> getFilesUnderPath(
      Path pathRelativeToProjectRoot, final Predicate<Path> predicate) throws IOException {
    final ImmutableSortedSet.Builder<Path> paths = ImmutableSortedSet.naturalOrder();
    if (!isDirectory(pathRelativeToProjectRoot)) {
      return paths.build();
    }
    walkRelativeFileTree(
        pathRelativeToProjectRoot,
        new SimpleFileVisitor<Path>() {
          @Override
          public FileVisitResult visitFile(Path path, BasicFileAttributes attributes) {
            if (predicate.test(path)) {
              paths.add(path);
            }
            return FileVisitResult.CONTINUE;
          }
        });
    return paths.build();
  }

  public void deleteFileAtPath(Path pathRelativeToProjectRoot) throws IOException {
    Files.delete(resolve(pathRelativeToProjectRoot));
  }

  public void deleteRecursivelyIfExists(Path pathRelativeToProjectRoot) throws IOException {
    Path path = resolve(pathRelativeToProjectRoot);
    if (Files.exists(path)) {
      MoreFiles.deleteRecursively(path, RecursiveDeleteOption.ALLOW_INSECURE);
    }
  }

  public void mkdirs(Path pathRelativeToProjectRoot) throws IOException {
    Files.createDirectories(resolve(pathRelativeToProjectRoot));
  }

  /**
   * @param pathRelativeToProjectRoot Must identify a file, not a directory. (Unfortunately, we have
   *     no way to assert this because the path is not expected to exist yet.)
   */
  public void createParentDirs(Path pathRelativeToProjectRoot) throws IOException {
    Path directory = resolve(pathRelativeToProjectRoot).getParent();
    if (directory != null) {
      Files.createDirectories(directory);
    }
  }

  /** Moves a file, creating the destination's parent directories. Fails if it already exists. */
  public void move(Path source, Path target) throws IOException {
    createParentDirs(target);
    Files.move(resolve(source), resolve(target));
  }

  /** Copies a file, creating the destination's parent directories. Fails if it already exists. */
  public void copyFile(Path source, Path target) throws IOException {
    createParentDirs(target);
    Files.copy(resolve(source), resolve(target));
  }

  /** Writes each line in {@code lines} with a trailing newline to a file at the specified path. */
  public void writeLinesToPath(Iterable<String> lines, Path pathRelativeToProjectRoot)
      throws IOException {
    StringBuilder contents = new StringBuilder();
    for (String line : lines) {
      contents.append(line).append('\n');
    }
    writeContentsToPath(contents.toString(), pathRelativeToProjectRoot);
  }

  public void writeContentsToPath(String contents, Path pathRelativeToProjectRoot)
      throws IOException {
    writeBytesToPath(contents.getBytes(StandardCharsets.UTF_8), pathRelativeToProjectRoot);
  }

  public void writeBytesToPath(byte[] bytes, Path pathRelativeToProjectRoot) throws IOException {
    createParentDirs(pathRelativeToProjectRoot);
    Files.write(resolve(pathRelativeToProjectRoot), bytes);
  }

  public ImmutableList<String> readLines(Path pathRelativeToProjectRoot) throws IOException {
    return ImmutableList.copyOf(
        Files.readAllLines(resolve(pathRelativeToProjectRoot), StandardCharsets.UTF_8));
  }

  public Optional<String> readFileIfItExists(Path pathRelativeToProjectRoot) throws IOException {
    Path fileToRead = resolve(pathRelativeToProjectRoot);
    if (!Files.isRegularFile(fileToRead)) {
      return Optional.empty();
    }
    return Optional.of(new String(Files.readAllBytes(fileToRead), StandardCharsets.UTF_8));
  }

  public InputStream newFileInputStream(Path pathRelativeToProjectRoot) throws IOException {
    return new BufferedInputStream(Files.newInputStream(resolve(pathRelativeToProjectRoot)));
  }

  public OutputStream newFileOutputStream(Path pathRelativeToProjectRoot) throws IOException {
    createParentDirs(pathRelativeToProjectRoot);
    return new BufferedOutputStream(Files.newOutputStream(resolve(pathRelativeToProjectRoot)));
  }

  @Override
  public String toString() {
    return "ProjectFilesystem{" + projectRoot + "}";
  }
}
