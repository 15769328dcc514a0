package io.github.randomcodespace.appliance.core;

import io.github.randomcodespace.appliance.builder.ContainerNames;
import io.github.randomcodespace.appliance.builder.ModuleCatalog;
import io.github.randomcodespace.appliance.builder.SpecBuilder;
import io.github.randomcodespace.appliance.config.ApplianceSettings;
import io.github.randomcodespace.appliance.dto.ContainerSpec;
import io.github.randomcodespace.appliance.dto.LifecycleResult;
import io.github.randomcodespace.appliance.dto.StorageResult;
import io.github.randomcodespace.appliance.enums.FailureKind;
import io.github.randomcodespace.appliance.storage.StorageProvisioner;
import io.github.randomcodespace.appliance.tools.ExtraContainerCli;
import io.github.randomcodespace.appliance.tools.NixosContainerCli;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives container creation, start, stop and destruction across storage and the host tools.
 *
 * <p>Calls for the same container name are queued and run one after another; calls for different
 * names run concurrently.
 */
public class ContainerOrchestrator implements ContainerLifecycle {
  private static final Logger logger = LoggerFactory.getLogger(ContainerOrchestrator.class);

  /** Module that enrolls the container in the mesh VPN and needs a pre-auth key. */
  public static final String ENROLLMENT_MODULE = "tailscale";

  private final StorageProvisioner storage;
  private final SpecBuilder specBuilder;
  private final ExtraContainerCli extraContainer;
  private final NixosContainerCli nixosContainer;
  private final InstallOutputClassifier classifier;
  private final ModuleCatalog moduleCatalog; // optional
  private final ApplianceSettings settings;
  private final NameSerializer serializer = new NameSerializer();

  public ContainerOrchestrator(
      StorageProvisioner storage,
      SpecBuilder specBuilder,
      ExtraContainerCli extraContainer,
      NixosContainerCli nixosContainer,
      ApplianceSettings settings) {
    this(
        storage,
        specBuilder,
        extraContainer,
        nixosContainer,
        new InstallOutputClassifier(),
        null,
        settings);
  }

  /**
   * @param moduleCatalog When non-null, requested modules are checked against the catalog before
   *     anything is provisioned.
   */
  public ContainerOrchestrator(
      StorageProvisioner storage,
      SpecBuilder specBuilder,
      ExtraContainerCli extraContainer,
      NixosContainerCli nixosContainer,
      InstallOutputClassifier classifier,
      ModuleCatalog moduleCatalog,
      ApplianceSettings settings) {
    this.storage = storage;
    this.specBuilder = specBuilder;
    this.extraContainer = extraContainer;
    this.nixosContainer = nixosContainer;
    this.classifier = classifier;
    this.moduleCatalog = moduleCatalog;
    this.settings = settings;
  }

  @Override
  public CompletableFuture<LifecycleResult> create(ContainerSpec spec, Path flakePath) {
    return serializer.submit(spec.getName(), () -> doCreate(spec, flakePath));
  }

  @Override
  public CompletableFuture<LifecycleResult> destroy(String name, String owner) {
    return withValidName(name, () -> doDestroy(name, owner));
  }

  @Override
  public CompletableFuture<LifecycleResult> start(String name) {
    return withValidName(
        name,
        () ->
            nixosContainer
                .start(name, settings.getLifecycleTimeout())
                .thenApply(
                    result ->
                        simpleOutcome(
                            name,
                            result,
                            "started",
                            "start_container",
                            FailureKind.START_FAILURE)));
  }

  @Override
  public CompletableFuture<LifecycleResult> stop(String name) {
    return withValidName(
        name,
        () ->
            nixosContainer
                .stop(name, settings.getLifecycleTimeout())
                .thenApply(
                    result ->
                        simpleOutcome(
                            name, result, "stopped", "stop_container", FailureKind.STOP_FAILURE)));
  }

  private CompletableFuture<LifecycleResult> withValidName(
      String name, Supplier<CompletableFuture<LifecycleResult>> operation) {
    Optional<String> error = ContainerNames.validate(name);
    if (error.isPresent()) {
      return CompletableFuture.completedFuture(
          LifecycleResult.failed(
              name, FailureKind.VALIDATION, "Invalid container name.", error.get()));
    }
    return serializer.submit(name, operation);
  }

  private LifecycleResult simpleOutcome(
      String name, ExecutionResult result, String verb, String operation, FailureKind kind) {
    if (result.succeeded()) {
      logger.info("Container '{}' {}", name, verb);
      return LifecycleResult.succeeded(name, "Container '" + name + "' " + verb + ".");
    }
    logger.error(
        "{} failed for '{}' (exit {}): {}",
        operation,
        name,
        result.exitCode(),
        result.errorDetail());
    return LifecycleResult.failed(
        name,
        kind,
        "Container '" + name + "' could not be " + verb + ".",
        result.errorDetail());
  }

  // --- create ---

  private CompletableFuture<LifecycleResult> doCreate(ContainerSpec spec, Path flakePath) {
    String name = spec.getName();
    Optional<String> tokenProblem = checkEnrollmentToken(spec);
    if (tokenProblem.isPresent()) {
      logger.warn("Rejecting container '{}': {}", name, tokenProblem.get());
      return CompletableFuture.completedFuture(
          LifecycleResult.failed(
              name, FailureKind.VALIDATION, "Container request rejected.", tokenProblem.get()));
    }
    return checkModules(spec)
        .thenCompose(
            moduleProblem -> {
              if (moduleProblem.isPresent()) {
                logger.warn("Rejecting container '{}': {}", name, moduleProblem.get());
                return CompletableFuture.completedFuture(
                    LifecycleResult.failed(
                        name,
                        FailureKind.VALIDATION,
                        "Container request rejected.",
                        moduleProblem.get()));
              }
              return storage
                  .provisionWorkspace(spec.getOwner(), name)
                  .thenCompose(provisioned -> buildAndStart(spec, flakePath, provisioned));
            });
  }

  private Optional<String> checkEnrollmentToken(ContainerSpec spec) {
    if (spec.requestsModule(ENROLLMENT_MODULE)
        && spec.getEnrollmentToken().isEmpty()
        && settings.getEnrollmentToken().isEmpty()) {
      return Optional.of(
          "Module '"
              + ENROLLMENT_MODULE
              + "' needs an enrollment token, but none was given and "
              + ApplianceSettings.ENROLLMENT_TOKEN_ENV
              + " is not set.");
    }
    return Optional.empty();
  }

  private CompletableFuture<Optional<String>> checkModules(ContainerSpec spec) {
    if (moduleCatalog == null) {
      return CompletableFuture.completedFuture(Optional.empty());
    }
    return moduleCatalog
        .availableModules()
        .handle(
            (available, ex) -> {
              if (ex != null) {
                logger.warn(
                    "Module discovery failed, skipping module check for '{}': {}",
                    spec.getName(),
                    ex.getMessage());
                return Optional.empty();
              }
              List<String> unknown =
                  spec.getModules().stream()
                      .filter(module -> !available.contains(module))
                      .collect(Collectors.toList());
              if (unknown.isEmpty()) {
                return Optional.empty();
              }
              return Optional.of(
                  "Unknown modules: "
                      + String.join(", ", unknown)
                      + ". Available: "
                      + String.join(", ", available));
            });
  }

  private CompletableFuture<LifecycleResult> buildAndStart(
      ContainerSpec spec, Path flakePath, StorageResult provisioned) {
    String name = spec.getName();
    if (!provisioned.isSuccess()) {
      logger.error(
          "create_container failed for '{}': storage provisioning failed: {}",
          name,
          provisioned.getMessage());
      return CompletableFuture.completedFuture(
          LifecycleResult.failed(
              name,
              FailureKind.PROVISIONING,
              "Storage provisioning failed: " + provisioned.getMessage(),
              provisioned.getError().orElse(provisioned.getMessage())));
    }

    ContainerSpec prepared =
        withInjectedToken(spec.withWorkspacePath(provisioned.getMountPath().orElseThrow()));
    String expression = specBuilder.build(prepared, flakePath);

    Path expressionFile;
    try {
      expressionFile =
          Files.createTempFile(
              settings.getExpressionDirectory(), "container-" + name + "-", ".nix");
      Files.writeString(expressionFile, expression, StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.error("Could not write expression for '{}': {}", name, e.getMessage());
      return classifyFailure(
          prepared,
          new ExecutionResult(-1, "", "Could not write container expression: " + e.getMessage()));
    }

    logger.info("Building container '{}' for owner {}", name, spec.getOwner());
    return extraContainer
        .createAndStart(expressionFile, settings.getBuildTimeout())
        .whenComplete((result, ex) -> deleteQuietly(expressionFile))
        .thenCompose(
            result -> {
              if (result.succeeded()) {
                logger.info("Container '{}' created and started", name);
                return CompletableFuture.completedFuture(
                    LifecycleResult.succeeded(
                        name, "Container '" + name + "' created and started."));
              }
              return classifyFailure(prepared, result);
            });
  }

  /** The settings key is only handed to containers that request enrollment without their own. */
  private ContainerSpec withInjectedToken(ContainerSpec spec) {
    if (spec.requestsModule(ENROLLMENT_MODULE) && spec.getEnrollmentToken().isEmpty()) {
      return spec.withEnrollmentToken(settings.getEnrollmentToken().orElseThrow());
    }
    return spec;
  }

  private CompletableFuture<LifecycleResult> classifyFailure(
      ContainerSpec spec, ExecutionResult result) {
    String name = spec.getName();
    BuildOutcome outcome = classifier.classify(name, result);
    if (!outcome.requiresStorageRollback()) {
      logger.error(
          "create_container failed for '{}' after installation started, keeping storage: {}",
          name,
          outcome.rawOutput());
      return CompletableFuture.completedFuture(
          LifecycleResult.failed(
              name,
              FailureKind.PARTIAL_INSTALL,
              "Container '"
                  + name
                  + "' failed during installation. Its storage was kept; destroy it to clean up.",
              outcome.rawOutput()));
    }

    logger.error("create_container failed for '{}' during build: {}", name, outcome.rawOutput());
    LifecycleResult failure =
        LifecycleResult.failed(
            name,
            FailureKind.BUILD_FAILURE,
            "Container '" + name + "' failed to build.",
            outcome.rawOutput());
    return storage
        .destroyWorkspace(spec.getOwner(), name)
        .handle(
            (cleanup, ex) -> {
              if (ex != null) {
                logger.error(
                    "Rollback of '{}' did not complete, orphaned ZFS dataset may remain: {}",
                    name,
                    ex.getMessage());
              } else if (!cleanup.isSuccess()) {
                logger.error(
                    "Rollback of '{}' failed, orphaned ZFS dataset {}: {}",
                    name,
                    cleanup.getDataset(),
                    cleanup.getError().orElse(cleanup.getMessage()));
              }
              return failure;
            });
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      logger.warn("Could not delete expression file {}: {}", file, e.getMessage());
    }
  }

  // --- destroy ---

  private CompletableFuture<LifecycleResult> doDestroy(String name, String owner) {
    return logout(name)
        .thenCompose(v -> extraContainer.destroy(name, settings.getDestroyTimeout()))
        .thenCompose(
            result -> {
              if (!result.succeeded()) {
                logger.error(
                    "destroy_container failed for '{}' (exit {}): {}",
                    name,
                    result.exitCode(),
                    result.errorDetail());
                return CompletableFuture.completedFuture(
                    LifecycleResult.failed(
                        name,
                        FailureKind.DESTROY_FAILURE,
                        "Container '" + name + "' could not be destroyed.",
                        result.errorDetail()));
              }
              logger.info("Container '{}' destroyed", name);
              if (owner == null) {
                return CompletableFuture.completedFuture(
                    LifecycleResult.succeeded(name, "Container '" + name + "' destroyed."));
              }
              return storage
                  .destroyWorkspace(owner, name)
                  .handle((cleanup, ex) -> afterStorageCleanup(name, owner, cleanup, ex));
            });
  }

  /** Releases the container's VPN identity. Never affects the outcome of the destroy. */
  private CompletableFuture<Void> logout(String name) {
    return nixosContainer
        .run(name, List.of("tailscale", "logout"), settings.getLogoutTimeout())
        .handle(
            (result, ex) -> {
              if (ex != null) {
                logger.debug(
                    "Tailscale logout for '{}' did not complete: {}", name, ex.getMessage());
              } else if (!result.succeeded()) {
                logger.debug(
                    "Tailscale logout for '{}' failed (exit {}): {}",
                    name,
                    result.exitCode(),
                    result.errorDetail());
              } else {
                logger.debug("Tailscale logout for '{}' done", name);
              }
              return null;
            });
  }

  private LifecycleResult afterStorageCleanup(
      String name, String owner, StorageResult cleanup, Throwable ex) {
    if (ex == null && cleanup.isSuccess()) {
      return LifecycleResult.succeeded(
          name, "Container '" + name + "' and its storage destroyed.");
    }
    String detail = ex != null ? ex.getMessage() : cleanup.getError().orElse(cleanup.getMessage());
    logger.error("ZFS cleanup failed for '{}' (owner {}): {}", name, owner, detail);
    return LifecycleResult.builder()
        .success(true)
        .name(name)
        .message("Container '" + name + "' destroyed, but storage cleanup failed.")
        .error(detail)
        .build();
  }
}
