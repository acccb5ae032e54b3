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

import com.facebook.resmerge.core.exceptions.ExternalToolFailureException;
import com.facebook.resmerge.core.exceptions.HumanReadableException;
import com.facebook.resmerge.core.util.log.Logger;
import com.facebook.resmerge.io.ProjectFilesystem;
import com.facebook.resmerge.step.AbstractExecutionStep;
import com.facebook.resmerge.step.DefaultStepRunner;
import com.facebook.resmerge.step.ExecutionContext;
import com.facebook.resmerge.step.Step;
import com.facebook.resmerge.step.StepExecutionResult;
import com.facebook.resmerge.step.StepExecutionResults;
import com.facebook.resmerge.step.StepFailedException;
import com.facebook.resmerge.zip.ZipSorter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.Nullable;

/**
 * Runs a whole merge: extracts the dependency resources into a workspace, normalizes and filters
 * them, links them with aapt2, checks the result and publishes the outputs.
 *
 * <p>Any failure aborts the run where it happens. Outputs are only published after every check
 * passed, and the workspace is discarded unless a debug root is configured.
 */
public class LinkOrchestrator {

  private static final Logger LOG = Logger.get(LinkOrchestrator.class);

  private static final String SORTED_PARTIAL_SUFFIX = ".sorted.zip";

  private final ResourceMergeOptions options;
  private final ExecutionContext context;
  private final DefaultStepRunner stepRunner;

  @Nullable private ResourceMergeState state;

  public LinkOrchestrator(ResourceMergeOptions options, ExecutionContext context) {
    this.options = options;
    this.context = context;
    this.stepRunner = new DefaultStepRunner(context);
  }

  /** @return the last phase completed, or {@code null} if none was. */
  @Nullable
  public ResourceMergeState getState() {
    return state;
  }

  private void advanceTo(ResourceMergeState next) {
    state = ResourceMergeState.advance(state, next);
    LOG.debug("Resource merge reached %s", next);
  }

  public void run() throws IOException, InterruptedException {
    ListeningExecutorService executorService =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                context.getConcurrencyLimit(),
                new ThreadFactoryBuilder().setNameFormat("resmerge-%d").setDaemon(true).build()));
    try (ResourceMergeWorkspace workspace =
        ResourceMergeWorkspace.create(options.getDebugOutputRoot(), getWorkspaceName())) {
      run(workspace, executorService);
    } catch (StepFailedException e) {
      throw new ExternalToolFailureException(e, e.getMessage());
    } finally {
      executorService.shutdownNow();
      executorService.awaitTermination(1, TimeUnit.MINUTES);
    }
  }

  private String getWorkspaceName() {
    Path output = options.getArscOutput().orElseGet(() -> options.getProtoOutput().get());
    return output.getFileName().toString();
  }

  void run(ResourceMergeWorkspace workspace, ListeningExecutorService executorService)
      throws IOException, InterruptedException, StepFailedException {
    ImmutableList<DependencyResources> dependencies =
        workspace.extractDependencies(options.getDependencyArchives());
    advanceTo(ResourceMergeState.EXTRACTED);

    Optional<PlatformDuplicator> duplicator = options.getPlatformDuplicator();
    if (duplicator.isPresent()) {
      duplicator.get().duplicateAll(dependencies);
    }
    LocaleNormalizer.normalizeAll(dependencies);
    advanceTo(ResourceMergeState.NORMALIZED);

    new LocaleStringFilter(createLocalePolicy(duplicator)).filter(dependencies);
    Predicate<Path> keep = createKeepFilter().createKeepPredicate(dependencies);
    ResourceKeepFilter.deleteRejected(dependencies, keep);
    advanceTo(ResourceMergeState.FILTERED);

    if (options.isPngToWebp()) {
      new ImageRecompressor(options.getWebpBinary().get())
          .recompress(dependencies, stepRunner, executorService);
    }
    DensityBucketMigrator.migrateAll(dependencies);
    advanceTo(ResourceMergeState.RECOMPRESSED);

    ProjectFilesystem workspaceFilesystem = workspace.getFilesystem();
    MergeLedgerWriter.write(
        dependencies, workspaceFilesystem, workspaceFilesystem.relativize(workspace.getInfoPath()));
    advanceTo(ResourceMergeState.LEDGER_WRITTEN);

    ImmutableList<Path> partials = compile(dependencies, workspace, executorService);
    PackageIdPolicy packageIdPolicy = PackageIdPolicy.fromOptions(options);
    link(workspace, partials, packageIdPolicy);
    advanceTo(ResourceMergeState.LINKED);

    validate(workspace, packageIdPolicy);
    advanceTo(ResourceMergeState.VALIDATED);

    createPublisher(workspace).publish();
    advanceTo(ResourceMergeState.FINALIZED);
  }

  private LocalePolicySet createLocalePolicy(Optional<PlatformDuplicator> duplicator)
      throws IOException {
    ImmutableSet<String> sharedNames = ImmutableSet.of();
    if (!options.getSharedLocaleAllowlist().isEmpty()) {
      sharedNames =
          ImmutableSet.copyOf(
              SymbolTable.read(options.getSharedResourcesAllowlist().get())
                  .getStringResourceNames());
    }
    return LocalePolicySet.fromLanguageTags(
        nonEmpty(options.getLocaleAllowlist()),
        nonEmpty(options.getSharedLocaleAllowlist()),
        sharedNames,
        duplicator);
  }

  private static Optional<ImmutableList<String>> nonEmpty(ImmutableList<String> list) {
    return list.isEmpty() ? Optional.empty() : Optional.of(list);
  }

  private ResourceKeepFilter createKeepFilter() {
    Optional<String> regex = options.getResourceBlacklistRegex().filter(r -> !r.isEmpty());
    if (!regex.isPresent()) {
      return ResourceKeepFilter.keepAll();
    }
    try {
      return new ResourceKeepFilter(
          Optional.of(Pattern.compile(regex.get())), options.getResourceBlacklistExceptions());
    } catch (PatternSyntaxException e) {
      throw new HumanReadableException(e, "Invalid resource blacklist regex: %s", regex.get());
    }
  }

  /** Compiles each dependency in parallel, then sorts each partial so linking is deterministic. */
  private ImmutableList<Path> compile(
      ImmutableList<DependencyResources> dependencies,
      ResourceMergeWorkspace workspace,
      ListeningExecutorService executorService)
      throws IOException, StepFailedException, InterruptedException {
    Files.createDirectories(workspace.getPartialsDir());
    ImmutableList.Builder<Step> compileSteps = ImmutableList.builder();
    ImmutableList.Builder<Step> sortSteps = ImmutableList.builder();
    ImmutableList.Builder<Path> sortedPartials = ImmutableList.builder();
    for (DependencyResources dependency : dependencies) {
      Path partial = workspace.getPartialsDir().resolve(dependency.getName() + ".zip");
      Path sortedPartial =
          workspace.getPartialsDir().resolve(dependency.getName() + SORTED_PARTIAL_SUFFIX);
      compileSteps.add(
          new Aapt2CompileStep(options.getAapt2(), dependency.getResourceRoot(), partial));
      sortSteps.add(
          new AbstractExecutionStep("sort_partial " + dependency.getName()) {
            @Override
            public StepExecutionResult execute(ExecutionContext context) throws IOException {
              ZipSorter.sortZip(partial, sortedPartial);
              return StepExecutionResults.SUCCESS;
            }
          });
      sortedPartials.add(sortedPartial);
    }
    stepRunner.runStepsInParallelAndWait(compileSteps.build(), executorService);
    stepRunner.runStepsInParallelAndWait(sortSteps.build(), executorService);
    LOG.info("Compiled %d resource directories", dependencies.size());
    return sortedPartials.build();
  }

  private void link(
      ResourceMergeWorkspace workspace,
      ImmutableList<Path> partials,
      PackageIdPolicy packageIdPolicy)
      throws IOException, StepFailedException, InterruptedException {
    String manifestPackage =
        options.getRenameManifestPackage().isPresent()
            ? options.getRenameManifestPackage().get()
            : ManifestVerifier.readPackageName(options.getAndroidManifest());

    Optional<Path> stableIds = Optional.empty();
    if (options.getStableIdsInput().isPresent()) {
      StableIdsRewriter.rewrite(
          options.getStableIdsInput().get(), workspace.getStableIdsPath(), manifestPackage);
      stableIds = Optional.of(workspace.getStableIdsPath());
    }

    if (options.getRTextInput().isPresent()) {
      Files.copy(options.getRTextInput().get(), workspace.getRTextPath());
    }

    stepRunner.runStep(
        new Aapt2LinkStep(
            options,
            workspace,
            options.getAndroidManifest(),
            manifestPackage,
            packageIdPolicy.getRequestedPackageId(),
            stableIds,
            partials));

    if (options.getProtoOutput().isPresent() && options.getArscOutput().isPresent()) {
      stepRunner.runStep(
          new Aapt2ConvertStep(
              options.getAapt2(), workspace.getProtoPath(), workspace.getArscPath()));
    }

    if (options.getOptimizedProtoOutput().isPresent()) {
      optimize(workspace, workspace.getProtoPath(), workspace.getOptimizedProtoPath());
    } else if (options.getOptimizedArscOutput().isPresent()) {
      optimize(workspace, workspace.getArscPath(), workspace.getOptimizedArscPath());
    }
  }

  private void optimize(ResourceMergeWorkspace workspace, Path input, Path output)
      throws IOException, StepFailedException, InterruptedException {
    Optional<Path> obfuscationConfig = Optional.empty();
    if (options.isStripResourceNames()) {
      ResourcesConfigWriter.write(
          options.getResourcesConfig(),
          workspace.getRTextPath(),
          workspace.getResourcesConfigPath());
      obfuscationConfig = Optional.of(workspace.getResourcesConfigPath());
    }
    stepRunner.runStep(
        new Aapt2OptimizeStep(
            options.getAapt2(),
            input,
            output,
            obfuscationConfig,
            options.isShortResourcePaths(),
            options
                .getResourcesPathMapOutput()
                .map(unused -> workspace.getResourcesPathMapPath())));
  }

  private void validate(ResourceMergeWorkspace workspace, PackageIdPolicy packageIdPolicy)
      throws IOException, StepFailedException, InterruptedException {
    Path linked =
        options.getArscOutput().isPresent() ? workspace.getArscPath() : workspace.getProtoPath();
    Aapt2DumpResourcesStep dump = new Aapt2DumpResourcesStep(options.getAapt2(), linked);
    stepRunner.runStep(dump);
    Optional<Integer> packageId = dump.getPackageId();
    if (!packageId.isPresent()) {
      throw new HumanReadableException("Could not find the package ID of %s", linked);
    }
    packageIdPolicy.verify(packageId.get());
    LOG.debug("Package ID %s", PackageIdPolicy.format(packageId.get()));

    if (options.getExpectedManifest().isPresent()) {
      ManifestVerifier.verify(
          options.getAndroidManifest(),
          options.getExpectedManifest().get(),
          workspace.getNormalizedManifestPath(),
          options.isFailOnUnexpectedManifest());
    }
  }

  private OutputPublisher createPublisher(ResourceMergeWorkspace workspace) {
    return new OutputPublisher()
        .add(workspace.getRTextPath(), options.getRTextOutput())
        .add(workspace.getArscPath(), options.getArscOutput())
        .add(workspace.getProtoPath(), options.getProtoOutput())
        .add(workspace.getOptimizedArscPath(), options.getOptimizedArscOutput())
        .add(workspace.getOptimizedProtoPath(), options.getOptimizedProtoOutput())
        .add(workspace.getProguardPath(), options.getProguardOutput())
        .add(workspace.getProguardMainDexPath(), options.getProguardMainDexOutput())
        .add(workspace.getEmitIdsPath(), options.getEmitIdsOutput())
        .add(workspace.getInfoPath(), options.getInfoOutput())
        .add(workspace.getResourcesPathMapPath(), options.getResourcesPathMapOutput())
        .add(
            workspace.getNormalizedManifestPath(),
            options.getExpectedManifest().isPresent()
                ? options.getNormalizedManifestOutput()
                : Optional.empty());
  }
}
