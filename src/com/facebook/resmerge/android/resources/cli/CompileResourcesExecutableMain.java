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

package com.facebook.resmerge.android.resources.cli;

import com.facebook.resmerge.android.resources.LinkOrchestrator;
import com.facebook.resmerge.android.resources.PackageIdPolicy;
import com.facebook.resmerge.android.resources.ResourceMergeOptions;
import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.facebook.resmerge.step.ExecutionContext;
import com.facebook.resmerge.util.DefaultProcessExecutor;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.logging.Level;
import javax.annotation.Nullable;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/** Main entry point for merging and linking the resources of an app. */
public class CompileResourcesExecutableMain {

  @Option(name = "--aapt2-path", required = true, usage = "Path to the aapt2 tool.")
  private String aapt2Path;

  @Option(name = "--dependencies-res-zips", usage = "GN list of resource archives to merge.")
  private String dependenciesResZips;

  @Option(name = "--include-resources", usage = "GN list of jars to link against.")
  private String includeResources;

  @Option(name = "--android-manifest", required = true)
  private String androidManifest;

  @Option(name = "--android-manifest-expected", usage = "Expected contents of the manifest.")
  private String androidManifestExpected;

  @Option(name = "--android-manifest-normalized")
  private String androidManifestNormalized;

  @Option(name = "--fail-if-unexpected-android-manifest")
  private boolean failIfUnexpectedAndroidManifest;

  @Option(name = "--shared-resources", forbids = "--app-as-shared-lib")
  private boolean sharedResources;

  @Option(name = "--app-as-shared-lib", forbids = "--shared-resources")
  private boolean appAsSharedLib;

  @Option(name = "--package-id", usage = "Custom package ID instead of 0x7f.")
  private String packageId;

  @Option(name = "--package-name-to-id-mapping", usage = "GN list of <name>=<id> entries.")
  private String packageNameToIdMapping;

  @Option(
      name = "--package-name",
      usage = "Looks up the package ID in the mapping. Overrides --package-id.")
  private String packageName;

  @Option(name = "--rename-manifest-package")
  private String renameManifestPackage;

  @Option(
      name = "--shared-resources-allowlist",
      aliases = "--shared-resources-whitelist",
      usage = "R.txt listing the shared resources.")
  private String sharedResourcesAllowlist;

  @Option(
      name = "--shared-resources-allowlist-locales",
      aliases = "--shared-resources-whitelist-locales",
      usage = "GN list of locales keeping the shared strings.")
  private String sharedResourcesAllowlistLocales;

  @Option(name = "--use-resource-ids-path", usage = "Stable IDs emitted by another link.")
  private String useResourceIdsPath;

  @Option(name = "--support-zh-hk", usage = "Use zh-rTW resources for zh-rHK.")
  private boolean supportZhHk;

  @Option(name = "--version-code")
  private String versionCode;

  @Option(name = "--version-name")
  private String versionName;

  @Option(name = "--min-sdk-version", required = true)
  private int minSdkVersion;

  @Option(name = "--target-sdk-version", required = true)
  private int targetSdkVersion;

  @Option(name = "--max-sdk-version")
  private Integer maxSdkVersion;

  @Option(
      name = "--locale-allowlist",
      aliases = "--locale-whitelist",
      usage = "GN list of locales to keep.")
  private String localeAllowlist;

  @Option(
      name = "--resource-blacklist-regex",
      aliases = "--resource-exclusion-regex",
      usage = "Do not include matching resources.")
  private String resourceBlacklistRegex;

  @Option(
      name = "--resource-blacklist-exceptions",
      aliases = "--resource-exclusion-exceptions",
      usage = "GN list of globs of excluded resources to keep anyway.")
  private String resourceBlacklistExceptions;

  @Option(name = "--png-to-webp")
  private boolean pngToWebp;

  @Option(name = "--webp-binary")
  private String webpBinary;

  @Option(name = "--no-xml-namespaces")
  private boolean noXmlNamespaces;

  @Option(name = "--short-resource-paths")
  private boolean shortResourcePaths;

  @Option(name = "--strip-resource-names")
  private boolean stripResourceNames;

  @Option(name = "--resources-config-path")
  private String resourcesConfigPath;

  @Option(name = "--r-text-in")
  private String rTextIn;

  @Option(name = "--arsc-path")
  private String arscPath;

  @Option(name = "--proto-path")
  private String protoPath;

  @Option(name = "--optimized-arsc-path")
  private String optimizedArscPath;

  @Option(name = "--optimized-proto-path")
  private String optimizedProtoPath;

  @Option(name = "--info-path")
  private String infoPath;

  @Option(name = "--r-text-out")
  private String rTextOut;

  @Option(name = "--proguard-file")
  private String proguardFile;

  @Option(name = "--proguard-file-main-dex")
  private String proguardFileMainDex;

  @Option(name = "--emit-ids-out")
  private String emitIdsOut;

  @Option(name = "--resources-path-map-out-path")
  private String resourcesPathMapOutPath;

  @Option(
      name = "--debug-temp-resources-dir",
      usage = "Keep intermediate files under this directory.")
  private String debugTempResourcesDir;

  @Option(name = "--verbose", usage = "Log every decision.")
  private boolean verbose;

  public static void main(String[] args) throws IOException, InterruptedException {
    CompileResourcesExecutableMain main = new CompileResourcesExecutableMain();
    CmdLineParser parser = new CmdLineParser(main);
    try {
      parser.parseArgument(args);
      main.run();
      System.exit(0);
    } catch (CmdLineException e) {
      System.err.println(e.getMessage());
      parser.printUsage(System.err);
      System.exit(1);
    } catch (HumanReadableException e) {
      System.err.println(e.getHumanReadableErrorMessage());
      System.exit(1);
    }
  }

  private void run() throws IOException, InterruptedException {
    if (verbose) {
      java.util.logging.Logger root = java.util.logging.Logger.getLogger("");
      root.setLevel(Level.FINE);
      for (java.util.logging.Handler handler : root.getHandlers()) {
        handler.setLevel(Level.FINE);
      }
    }
    ExecutionContext context =
        ExecutionContext.builder().setProcessExecutor(new DefaultProcessExecutor()).build();
    new LinkOrchestrator(buildOptions(), context).run();
  }

  ResourceMergeOptions buildOptions() {
    ResourceMergeOptions.Builder builder =
        ResourceMergeOptions.builder()
            .setAapt2(Paths.get(aapt2Path))
            .setAndroidManifest(Paths.get(androidManifest))
            .setExpectedManifest(toPath(androidManifestExpected))
            .setNormalizedManifestOutput(toPath(androidManifestNormalized))
            .setFailOnUnexpectedManifest(failIfUnexpectedAndroidManifest)
            .setSharedResources(sharedResources)
            .setAppAsSharedLib(appAsSharedLib)
            .setSharedResourcesAllowlist(toPath(sharedResourcesAllowlist))
            .setPackageName(Optional.ofNullable(packageName))
            .putAllPackageNameToId(GnLists.parsePackageIds(packageNameToIdMapping))
            .setRenameManifestPackage(Optional.ofNullable(renameManifestPackage))
            .setStableIdsInput(toPath(useResourceIdsPath))
            .setVersionCode(Optional.ofNullable(versionCode))
            .setVersionName(Optional.ofNullable(versionName))
            .setMinSdkVersion(minSdkVersion)
            .setTargetSdkVersion(targetSdkVersion)
            .setMaxSdkVersion(Optional.ofNullable(maxSdkVersion))
            .addAllLocaleAllowlist(GnLists.parse(localeAllowlist))
            .addAllSharedLocaleAllowlist(GnLists.parse(sharedResourcesAllowlistLocales))
            .setSupportZhHk(supportZhHk)
            .setResourceBlacklistRegex(Optional.ofNullable(resourceBlacklistRegex))
            .addAllResourceBlacklistExceptions(GnLists.parse(resourceBlacklistExceptions))
            .setPngToWebp(pngToWebp)
            .setWebpBinary(toPath(webpBinary))
            .setNoXmlNamespaces(noXmlNamespaces)
            .setShortResourcePaths(shortResourcePaths)
            .setStripResourceNames(stripResourceNames)
            .setResourcesConfig(toPath(resourcesConfigPath))
            .setRTextInput(toPath(rTextIn))
            .setArscOutput(toPath(arscPath))
            .setProtoOutput(toPath(protoPath))
            .setOptimizedArscOutput(toPath(optimizedArscPath))
            .setOptimizedProtoOutput(toPath(optimizedProtoPath))
            .setInfoOutput(toPath(infoPath))
            .setRTextOutput(toPath(rTextOut))
            .setProguardOutput(toPath(proguardFile))
            .setProguardMainDexOutput(toPath(proguardFileMainDex))
            .setEmitIdsOutput(toPath(emitIdsOut))
            .setResourcesPathMapOutput(toPath(resourcesPathMapOutPath))
            .setDebugOutputRoot(toPath(debugTempResourcesDir));
    for (String archive : GnLists.parse(dependenciesResZips)) {
      builder.addDependencyArchives(Paths.get(archive));
    }
    for (String include : GnLists.parse(includeResources)) {
      builder.addIncludeResources(Paths.get(include));
    }
    if (packageId != null) {
      try {
        builder.setPackageId(PackageIdPolicy.parse(packageId));
      } catch (NumberFormatException e) {
        throw new HumanReadableException(e, "Invalid package ID: %s", packageId);
      }
    }
    return builder.build();
  }

  private static Optional<Path> toPath(@Nullable String path) {
    return path == null || path.isEmpty() ? Optional.empty() : Optional.of(Paths.get(path));
  }
}
