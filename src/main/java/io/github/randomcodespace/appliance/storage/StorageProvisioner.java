package io.github.randomcodespace.appliance.storage;

import io.github.randomcodespace.appliance.builder.ContainerNames;
import io.github.randomcodespace.appliance.config.ApplianceSettings;
import io.github.randomcodespace.appliance.dto.StorageResult;
import io.github.randomcodespace.appliance.dto.StorageUsage;
import io.github.randomcodespace.appliance.tools.ZfsCli;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import io.github.randomcodespace.appliance.utils.SizeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the per-owner dataset hierarchy described by {@link DatasetLayout}. Every operation is
 * idempotent and reports failures as a {@link StorageResult}; only a {@code
 * CommandTimeoutException} fails the returned future.
 *
 * <p>Existence checks and the create or mount that follows are not atomic. Two concurrent calls
 * for the same dataset can race; lifecycle calls for one container name are serialized upstream.
 */
public class StorageProvisioner {
  private static final Logger logger = LoggerFactory.getLogger(StorageProvisioner.class);

  private final ZfsCli zfs;
  private final DatasetLayout layout;
  private final String userQuota;

  public StorageProvisioner(ZfsCli zfs, ApplianceSettings settings) {
    this(zfs, new DatasetLayout(settings.getDatasetRoot()), settings.getUserQuota());
  }

  public StorageProvisioner(ZfsCli zfs, DatasetLayout layout, String userQuota) {
    this.zfs = zfs;
    this.layout = layout;
    this.userQuota = userQuota;
  }

  /**
   * Ensures {@code root/owner} exists and is mounted, then applies the configured quota. The quota
   * is applied on every call, so a changed setting reaches existing owners the next time they
   * provision anything. A quota that cannot be applied fails the call.
   */
  public CompletableFuture<StorageResult> provisionUserRoot(String owner) {
    String dataset = layout.userRoot(owner);
    if (!DatasetLayout.isValidOwnerSegment(owner)) {
      return CompletableFuture.completedFuture(invalidOwner(owner, dataset));
    }
    return exists(dataset)
        .thenCompose(
            present -> {
              if (present) {
                logger.debug("User dataset '{}' already exists", dataset);
              }
              CompletableFuture<StorageResult> node =
                  present ? ensureMounted(dataset) : createNode(dataset);
              return onSuccess(node, () -> applyQuota(dataset, present));
            });
  }

  /** Mounts {@code dataset} unless it already is. A failed mount is reported, not retried. */
  public CompletableFuture<StorageResult> ensureMounted(String dataset) {
    return zfs.getMounted(dataset)
        .thenCompose(
            state -> {
              if (!state.succeeded()) {
                logger.error(
                    "Mount state query failed: dataset={} exitCode={} stderr={}",
                    dataset,
                    state.exitCode(),
                    state.stderr());
                return CompletableFuture.completedFuture(
                    failure(dataset, "Failed to query mount state of '" + dataset + "'.", state));
              }
              if ("yes".equals(state.stdout().trim())) {
                return CompletableFuture.completedFuture(
                    success(dataset, "Dataset '" + dataset + "' is mounted.", null));
              }
              logger.info("Dataset '{}' exists but is not mounted, mounting", dataset);
              return zfs.mount(dataset)
                  .thenApply(
                      mount -> {
                        if (mount.succeeded()) {
                          return success(dataset, "Mounted dataset '" + dataset + "'.", null);
                        }
                        logger.error(
                            "Mount failed: dataset={} exitCode={} stderr={}",
                            dataset,
                            mount.exitCode(),
                            mount.stderr());
                        return failure(dataset, "Failed to mount '" + dataset + "'.", mount);
                      });
            });
  }

  /**
   * Makes the workspace dataset for {@code (owner, name)} exist and be mounted.
   *
   * @return On success, a result whose mount path is the host directory to bind-mount into the
   *     container.
   */
  public CompletableFuture<StorageResult> provisionWorkspace(String owner, String name) {
    String workspace = layout.workspace(owner, name);
    String mountPath = layout.mountPath(workspace);
    Optional<String> nameError = ContainerNames.validate(name);
    if (nameError.isPresent()) {
      return CompletableFuture.completedFuture(
          StorageResult.builder()
              .success(false)
              .dataset(workspace)
              .message("Refusing to provision storage for an invalid container name.")
              .error(nameError.get())
              .build());
    }

    return provisionUserRoot(owner)
        .thenCompose(
            userRoot -> {
              if (!userRoot.isSuccess()) {
                return CompletableFuture.completedFuture(
                    StorageResult.builder()
                        .success(false)
                        .dataset(workspace)
                        .message("Failed to create container dataset: " + userRoot.getMessage())
                        .error(userRoot.getError().orElse(null))
                        .build());
              }
              return exists(workspace).thenCompose(present -> workspace(owner, name, present));
            })
        .thenApply(
            result -> {
              if (!result.isSuccess()) {
                return result;
              }
              return StorageResult.builder()
                  .success(true)
                  .dataset(workspace)
                  .message(result.getMessage())
                  .mountPath(mountPath)
                  .build();
            });
  }

  private CompletableFuture<StorageResult> workspace(String owner, String name, boolean present) {
    String workspace = layout.workspace(owner, name);
    if (present) {
      logger.info("Container dataset '{}' already exists", workspace);
      return onSuccess(
          ensureMounted(workspace),
          () -> {
            String message = "Container dataset '" + workspace + "' already exists.";
            return CompletableFuture.completedFuture(success(workspace, message, null));
          });
    }
    CompletableFuture<StorageResult> containers = ensureNode(layout.containersRoot(owner));
    CompletableFuture<StorageResult> container =
        onSuccess(containers, () -> ensureNode(layout.containerRoot(owner, name)));
    return onSuccess(container, () -> createNode(workspace));
  }

  /**
   * Recursively destroys {@code root/owner/containers/name}. The owner's root dataset and other
   * containers are never touched. Succeeds without issuing a destroy when nothing is there.
   */
  public CompletableFuture<StorageResult> destroyWorkspace(String owner, String name) {
    String dataset = layout.containerRoot(owner, name);
    if (!DatasetLayout.isValidOwnerSegment(owner) || ContainerNames.validate(name).isPresent()) {
      return CompletableFuture.completedFuture(
          StorageResult.builder()
              .success(false)
              .dataset(dataset)
              .message("Refusing to destroy storage for an invalid owner or container name.")
              .error("owner='" + owner + "', name='" + name + "'")
              .build());
    }
    return exists(dataset)
        .thenCompose(
            present -> {
              if (!present) {
                logger.info("Container dataset '{}' does not exist, nothing to destroy", dataset);
                return CompletableFuture.completedFuture(
                    success(
                        dataset,
                        "Container dataset '" + dataset + "' does not exist (already clean).",
                        null));
              }
              return zfs.destroyRecursive(dataset)
                  .thenApply(
                      destroy -> {
                        if (destroy.succeeded()) {
                          logger.info("Destroyed container dataset '{}'", dataset);
                          return success(
                              dataset, "Destroyed container dataset '" + dataset + "'.", null);
                        }
                        logger.error(
                            "destroyWorkspace failed: dataset={} exitCode={} stderr={}",
                            dataset,
                            destroy.exitCode(),
                            destroy.stderr());
                        return failure(
                            dataset,
                            "Failed to destroy container dataset '" + dataset + "'.",
                            destroy);
                      });
            });
  }

  /** Quota, used and available space of the owner's root dataset, human-readable. */
  public CompletableFuture<StorageUsage> getUserStorageInfo(String owner) {
    String dataset = layout.userRoot(owner);
    return zfs.getSpace(dataset)
        .thenApply(
            result -> {
              if (!result.succeeded()) {
                logger.error(
                    "Failed to query storage info for '{}': {}", dataset, result.stderr());
                return StorageUsage.builder()
                    .success(false)
                    .owner(owner)
                    .quota("unknown")
                    .used("unknown")
                    .available("unknown")
                    .message("Failed to query storage for user '" + owner + "'.")
                    .error(result.errorDetail())
                    .build();
              }
              Map<String, String> props = new HashMap<>();
              for (String line : result.stdout().split("\n")) {
                String[] parts = line.split("\t", 2);
                if (parts.length == 2) {
                  props.put(parts[0].trim(), parts[1].trim());
                }
              }
              String quota = SizeFormatter.humanSize(props.getOrDefault("quota", "0"));
              String used = SizeFormatter.humanSize(props.getOrDefault("used", "0"));
              String available = SizeFormatter.humanSize(props.getOrDefault("available", "0"));
              logger.debug(
                  "Storage info for '{}': quota={}, used={}, available={}",
                  dataset,
                  quota,
                  used,
                  available);
              return StorageUsage.builder()
                  .success(true)
                  .owner(owner)
                  .quota(quota)
                  .used(used)
                  .available(available)
                  .message(
                      "Storage for user '"
                          + owner
                          + "': used "
                          + used
                          + " of "
                          + quota
                          + " quota ("
                          + available
                          + " available).")
                  .build();
            });
  }

  private CompletableFuture<Boolean> exists(String dataset) {
    return zfs.list(dataset).thenApply(ExecutionResult::succeeded);
  }

  /** Intermediate nodes: created when missing, mounted when present. */
  private CompletableFuture<StorageResult> ensureNode(String dataset) {
    return exists(dataset)
        .thenCompose(present -> present ? ensureMounted(dataset) : createNode(dataset));
  }

  private CompletableFuture<StorageResult> createNode(String dataset) {
    String mountPath = layout.mountPath(dataset);
    return zfs.create(dataset, mountPath)
        .thenApply(
            result -> {
              if (result.succeeded()) {
                logger.info("Created dataset '{}' at {}", dataset, mountPath);
                return success(dataset, "Created dataset '" + dataset + "'.", null);
              }
              logger.error(
                  "Dataset creation failed: dataset={} exitCode={} stderr={}",
                  dataset,
                  result.exitCode(),
                  result.stderr());
              return failure(dataset, "Failed to create dataset '" + dataset + "'.", result);
            });
  }

  private CompletableFuture<StorageResult> applyQuota(String dataset, boolean existed) {
    return zfs.setQuota(dataset, userQuota)
        .thenApply(
            result -> {
              if (result.succeeded()) {
                logger.info("Applied quota {} to dataset '{}'", userQuota, dataset);
                String state = existed ? "already exists" : "created";
                return success(
                    dataset,
                    "User dataset '" + dataset + "' " + state + " (quota: " + userQuota + ").",
                    null);
              }
              logger.error(
                  "Quota application failed: dataset={} quota={} exitCode={} stderr={}",
                  dataset,
                  userQuota,
                  result.exitCode(),
                  result.stderr());
              return failure(
                  dataset, "Failed to apply quota " + userQuota + " to '" + dataset + "'.", result);
            });
  }

  private static CompletableFuture<StorageResult> onSuccess(
      CompletableFuture<StorageResult> previous, Supplier<CompletableFuture<StorageResult>> next) {
    return previous.thenCompose(
        result -> result.isSuccess() ? next.get() : CompletableFuture.completedFuture(result));
  }

  private StorageResult invalidOwner(String owner, String dataset) {
    return StorageResult.builder()
        .success(false)
        .dataset(dataset)
        .message("Owner '" + owner + "' cannot be used as a dataset name.")
        .error("invalid owner")
        .build();
  }

  private static StorageResult success(String dataset, String message, String mountPath) {
    return StorageResult.builder()
        .success(true)
        .dataset(dataset)
        .message(message)
        .mountPath(mountPath)
        .build();
  }

  private static StorageResult failure(String dataset, String message, ExecutionResult result) {
    return StorageResult.builder()
        .success(false)
        .dataset(dataset)
        .message(message)
        .error(result.errorDetail())
        .build();
  }
}
