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

import com.facebook.resmerge.core.exceptions.ConfigurationContradictionException;
import com.facebook.resmerge.core.util.immutables.ResMergeStyleImmutable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Everything a merge run needs to know. Option combinations that contradict each other are
 * rejected when the value is built.
 */
@Value.Immutable
@ResMergeStyleImmutable
abstract class AbstractResourceMergeOptions {

  public abstract Path getAapt2();

  /** Resource archives of the dependencies, in link order. */
  public abstract ImmutableList<Path> getDependencyArchives();

  public abstract Path getAndroidManifest();

  /** Checked-in expectation for the manifest handed to the linker. */
  public abstract Optional<Path> getExpectedManifest();

  public abstract Optional<Path> getNormalizedManifestOutput();

  /** Whether a manifest that differs from its expectation fails the run, or only warns. */
  @Value.Default
  public boolean isFailOnUnexpectedManifest() {
    return false;
  }

  /** Platform jars and other resource packages to link against. */
  public abstract ImmutableList<Path> getIncludeResources();

  @Value.Default
  public boolean isSharedResources() {
    return false;
  }

  @Value.Default
  public boolean isAppAsSharedLib() {
    return false;
  }

  /** An {@code R.txt} listing the shared resources. Implies shared resources. */
  public abstract Optional<Path> getSharedResourcesAllowlist();

  public abstract Optional<Integer> getPackageId();

  /** Looked up in {@link #getPackageNameToId()} to find the package ID. */
  public abstract Optional<String> getPackageName();

  public abstract ImmutableMap<String, Integer> getPackageNameToId();

  public abstract Optional<String> getRenameManifestPackage();

  /** A file written by {@code aapt2 link --emit-ids}, possibly for another package. */
  public abstract Optional<Path> getStableIdsInput();

  public abstract Optional<String> getVersionCode();

  public abstract Optional<String> getVersionName();

  public abstract int getMinSdkVersion();

  public abstract int getTargetSdkVersion();

  public abstract Optional<Integer> getMaxSdkVersion();

  /** Language tags to keep. Empty keeps every locale. */
  public abstract ImmutableList<String> getLocaleAllowlist();

  /** Language tags for which the shared strings are kept. Empty means the same as above. */
  public abstract ImmutableList<String> getSharedLocaleAllowlist();

  /** Fill zh-HK with the zh-TW resources. */
  @Value.Default
  public boolean isSupportZhHk() {
    return false;
  }

  public abstract Optional<String> getResourceBlacklistRegex();

  public abstract ImmutableList<String> getResourceBlacklistExceptions();

  @Value.Default
  public boolean isPngToWebp() {
    return false;
  }

  public abstract Optional<Path> getWebpBinary();

  @Value.Default
  public boolean isNoXmlNamespaces() {
    return false;
  }

  @Value.Default
  public boolean isShortResourcePaths() {
    return false;
  }

  @Value.Default
  public boolean isStripResourceNames() {
    return false;
  }

  /** Base config for {@code aapt2 optimize}, extended when resource names are stripped. */
  public abstract Optional<Path> getResourcesConfig();

  /** Use this symbol listing instead of the one the linker writes. */
  public abstract Optional<Path> getRTextInput();

  public abstract Optional<Path> getArscOutput();

  public abstract Optional<Path> getProtoOutput();

  public abstract Optional<Path> getOptimizedArscOutput();

  public abstract Optional<Path> getOptimizedProtoOutput();

  public abstract Optional<Path> getInfoOutput();

  public abstract Optional<Path> getRTextOutput();

  public abstract Optional<Path> getProguardOutput();

  public abstract Optional<Path> getProguardMainDexOutput();

  public abstract Optional<Path> getEmitIdsOutput();

  public abstract Optional<Path> getResourcesPathMapOutput();

  /**
   * If set, the workspace is created under this directory instead of a temporary one, and kept
   * after the run.
   */
  public abstract Optional<Path> getDebugOutputRoot();

  public boolean usesSharedResources() {
    return isSharedResources() || getSharedResourcesAllowlist().isPresent();
  }

  public Optional<PlatformDuplicator> getPlatformDuplicator() {
    return isSupportZhHk() ? Optional.of(PlatformDuplicator.createDefault()) : Optional.empty();
  }

  @Value.Check
  protected void check() {
    if (!getArscOutput().isPresent() && !getProtoOutput().isPresent()) {
      throw new ConfigurationContradictionException(
          "One of the arsc or proto outputs is required.");
    }
    if (getOptimizedArscOutput().isPresent() && getOptimizedProtoOutput().isPresent()) {
      throw new ConfigurationContradictionException(
          "Only one of the optimized arsc and optimized proto outputs can be requested.");
    }
    if (getOptimizedProtoOutput().isPresent() && !getProtoOutput().isPresent()) {
      throw new ConfigurationContradictionException(
          "The optimized proto output requires the proto output.");
    }
    if (getOptimizedArscOutput().isPresent() && !getArscOutput().isPresent()) {
      throw new ConfigurationContradictionException(
          "The optimized arsc output requires the arsc output.");
    }
    if (getResourcesPathMapOutput().isPresent() && !isShortResourcePaths()) {
      throw new ConfigurationContradictionException(
          "The resource path map output requires short resource paths.");
    }
    if (isSharedResources() && isAppAsSharedLib()) {
      throw new ConfigurationContradictionException(
          "Shared resources and app-as-shared-lib are mutually exclusive.");
    }
    if (getPackageId().isPresent() && usesSharedResources()) {
      throw new ConfigurationContradictionException(
          "A custom package ID cannot be used with shared resources.");
    }
    if (getMinSdkVersion() > getTargetSdkVersion()) {
      throw new ConfigurationContradictionException(
          "Min SDK version %d is above target SDK version %d.",
          getMinSdkVersion(),
          getTargetSdkVersion());
    }
    if (getMaxSdkVersion().isPresent() && getTargetSdkVersion() > getMaxSdkVersion().get()) {
      throw new ConfigurationContradictionException(
          "Target SDK version %d is above max SDK version %d.",
          getTargetSdkVersion(),
          getMaxSdkVersion().get());
    }
    if (isPngToWebp() && !getWebpBinary().isPresent()) {
      throw new ConfigurationContradictionException(
          "Converting images to WebP requires the cwebp binary.");
    }
    if (!getSharedLocaleAllowlist().isEmpty() && !getSharedResourcesAllowlist().isPresent()) {
      throw new ConfigurationContradictionException(
          "A shared locale allow-list requires a shared resources allow-list.");
    }
    if (getPlatformDuplicator().isPresent()) {
      PlatformDuplicator duplicator = getPlatformDuplicator().get();
      duplicator.checkTargetNotRequested(parseLanguageTags(getLocaleAllowlist()));
      duplicator.checkTargetNotRequested(parseLanguageTags(getSharedLocaleAllowlist()));
    }
  }

  private static ImmutableList<LocaleQualifier> parseLanguageTags(ImmutableList<String> tags) {
    return tags.stream()
        .map(LocaleQualifier::fromLanguageTag)
        .flatMap(Optional::stream)
        .collect(ImmutableList.toImmutableList());
  }
}
