package io.github.randomcodespace.appliance.core;

import io.github.randomcodespace.appliance.dto.ContainerSpec;
import io.github.randomcodespace.appliance.dto.LifecycleResult;
import io.github.randomcodespace.appliance.exceptions.CommandTimeoutException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Lifecycle of declarative containers. Failures are reported in the returned {@link
 * LifecycleResult}; the future itself only fails with {@link CommandTimeoutException} when a host
 * command exceeds its bound.
 */
public interface ContainerLifecycle {

  /**
   * Provisions the workspace, builds the container from {@code spec} and starts it.
   *
   * @param spec The validated container request.
   * @param flakePath Root of the flake holding {@code nix/mkContainer.nix}.
   * @return A CompletableFuture holding the outcome.
   */
  CompletableFuture<LifecycleResult> create(ContainerSpec spec, Path flakePath);

  /**
   * Destroys a container and, when {@code owner} is given, its storage.
   *
   * @param name The container name.
   * @param owner The owner whose workspace should be removed, or null to keep storage.
   * @return A CompletableFuture holding the outcome.
   */
  CompletableFuture<LifecycleResult> destroy(String name, String owner);

  CompletableFuture<LifecycleResult> start(String name);

  CompletableFuture<LifecycleResult> stop(String name);
}
