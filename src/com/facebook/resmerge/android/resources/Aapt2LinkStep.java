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

import com.facebook.resmerge.shell.ShellStep;
import com.facebook.resmerge.step.ExecutionContext;
import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.Optional;

/** Links the compiled partials of every dependency into one resource package. */
public class Aapt2LinkStep extends ShellStep {

  private final ResourceMergeOptions options;
  private final ResourceMergeWorkspace workspace;
  private final Path manifest;
  private final String manifestPackage;
  private final Optional<Integer> packageId;
  private final Optional<Path> stableIds;
  private final ImmutableList<Path> partials;

  /**
   * @param manifestPackage the package the manifest is renamed to.
   * @param packageId if present, passed to the linker, which otherwise uses 0x7f.
   * @param stableIds a stable IDs file already rewritten for {@code manifestPackage}.
   */
  public Aapt2LinkStep(
      ResourceMergeOptions options,
      ResourceMergeWorkspace workspace,
      Path manifest,
      String manifestPackage,
      Optional<Integer> packageId,
      Optional<Path> stableIds,
      ImmutableList<Path> partials) {
    this.options = options;
    this.workspace = workspace;
    this.manifest = manifest;
    this.manifestPackage = manifestPackage;
    this.packageId = packageId;
    this.stableIds = stableIds;
    this.partials = partials;
  }

  @Override
  public String getShortName() {
    return "aapt2_link";
  }

  @Override
  protected ImmutableList<String> getShellCommandInternal(ExecutionContext context) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    builder.add(options.getAapt2().toString(), "link");
    builder.add("--auto-add-overlay");
    builder.add("--no-version-vectors");
    // In case the manifest does not set them.
    builder.add("--min-sdk-version", String.valueOf(options.getMinSdkVersion()));
    builder.add("--target-sdk-version", String.valueOf(options.getTargetSdkVersion()));

    for (Path include : options.getIncludeResources()) {
      builder.add("-I", include.toString());
    }
    options.getVersionCode().ifPresent(code -> builder.add("--version-code", code));
    options.getVersionName().ifPresent(name -> builder.add("--version-name", name));
    if (options.getProguardOutput().isPresent()) {
      builder.add("--proguard", workspace.getProguardPath().toString());
    }
    if (options.getProguardMainDexOutput().isPresent()) {
      builder.add("--proguard-main-dex", workspace.getProguardMainDexPath().toString());
    }
    if (options.getEmitIdsOutput().isPresent()) {
      builder.add("--emit-ids", workspace.getEmitIdsPath().toString());
    }
    if (!options.getRTextInput().isPresent()) {
      builder.add("--output-text-symbols", workspace.getRTextPath().toString());
    }

    // Recent aapt2 versions accept only one of --proto-format and --shared-lib.
    if (options.usesSharedResources() && !options.getProtoOutput().isPresent()) {
      builder.add("--shared-lib");
    }

    if (options.isNoXmlNamespaces()) {
      builder.add("--no-xml-namespaces");
    }

    if (packageId.isPresent()) {
      builder.add("--package-id", String.format("0x%02x", packageId.get()));
      builder.add("--allow-reserved-package-id");
    }

    builder.add("--manifest", manifest.toString());
    builder.add("--rename-manifest-package", manifestPackage);

    if (stableIds.isPresent()) {
      builder.add("--stable-ids", stableIds.get().toString());
    }

    for (Path partial : partials) {
      builder.add("-R", partial.toString());
    }

    if (options.getProtoOutput().isPresent()) {
      builder.add("--proto-format", "-o", workspace.getProtoPath().toString());
    } else {
      builder.add("-o", workspace.getArscPath().toString());
    }
    return builder.build();
  }
}
