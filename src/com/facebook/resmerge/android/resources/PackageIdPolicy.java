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
import com.facebook.resmerge.core.exceptions.PolicyMismatchException;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;

/**
 * Which package ID the linked resources must use: the ID mapped to the package name, else an
 * explicit ID, else 0x00 for shared resources, else 0x7f.
 */
public class PackageIdPolicy {

  public static final int APP_PACKAGE_ID = 0x7f;
  public static final int SHARED_LIBRARY_PACKAGE_ID = 0x00;

  private final Optional<Integer> requestedPackageId;
  private final boolean sharedResources;

  PackageIdPolicy(Optional<Integer> requestedPackageId, boolean sharedResources) {
    this.requestedPackageId = requestedPackageId;
    this.sharedResources = sharedResources;
  }

  /**
   * A package name, when given, overrides {@code packageId}.
   *
   * @throws MissingResourceException if the package name has no ID.
   */
  public static PackageIdPolicy create(
      Optional<Integer> packageId,
      Optional<String> packageName,
      ImmutableMap<String, Integer> packageNameToId,
      boolean sharedResources) {
    if (packageName.isPresent()) {
      Integer mapped = packageNameToId.get(packageName.get());
      if (mapped == null) {
        throw new MissingResourceException(
            "Package name %s is not present in the package name to ID mapping %s.",
            packageName.get(),
            packageNameToId);
      }
      return new PackageIdPolicy(Optional.of(mapped), sharedResources);
    }
    return new PackageIdPolicy(packageId, sharedResources);
  }

  public static PackageIdPolicy fromOptions(ResourceMergeOptions options) {
    return create(
        options.getPackageId(),
        options.getPackageName(),
        options.getPackageNameToId(),
        options.usesSharedResources());
  }

  /** The ID to ask the linker for, if not its default. */
  public Optional<Integer> getRequestedPackageId() {
    return requestedPackageId;
  }

  public int getExpectedPackageId() {
    if (requestedPackageId.isPresent()) {
      return requestedPackageId.get();
    }
    return sharedResources ? SHARED_LIBRARY_PACKAGE_ID : APP_PACKAGE_ID;
  }

  /** @throws PolicyMismatchException if {@code actualPackageId} is not the expected ID. */
  public void verify(int actualPackageId) {
    int expected = getExpectedPackageId();
    if (actualPackageId != expected) {
      throw new PolicyMismatchException(
          "Invalid package ID %s (expected %s)", format(actualPackageId), format(expected));
    }
  }

  public static String format(int packageId) {
    return String.format("0x%02x", packageId);
  }

  /** Parses {@code 0x7f}, {@code 127} and the like. */
  public static int parse(String packageId) {
    return Integer.decode(packageId.trim());
  }
}
