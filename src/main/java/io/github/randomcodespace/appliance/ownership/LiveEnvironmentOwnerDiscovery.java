package io.github.randomcodespace.appliance.ownership;

import io.github.randomcodespace.appliance.tools.NixosContainerCli;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks a running container for its owner variable. Only works while the container is up; a
 * stopped container, a timeout or an empty answer all yield no owner.
 */
public class LiveEnvironmentOwnerDiscovery implements OwnerDiscovery {
  private static final Logger logger =
      LoggerFactory.getLogger(LiveEnvironmentOwnerDiscovery.class);

  private final NixosContainerCli nixosContainer;
  private final String ownerVariable;
  private final Duration timeout;

  public LiveEnvironmentOwnerDiscovery(
      NixosContainerCli nixosContainer, String ownerVariable, Duration timeout) {
    this.nixosContainer = nixosContainer;
    this.ownerVariable = ownerVariable;
    this.timeout = timeout;
  }

  @Override
  public String name() {
    return "live-environment";
  }

  @Override
  public CompletableFuture<Optional<String>> discover(String containerName) {
    return nixosContainer
        .run(containerName, List.of("sh", "-c", "echo $" + ownerVariable), timeout)
        .thenApply(
            result -> {
              if (!result.succeeded()) {
                logger.debug(
                    "Live owner query failed for '{}' (exit {}): {}",
                    containerName,
                    result.exitCode(),
                    result.errorDetail());
                return Optional.<String>empty();
              }
              String owner = result.stdout().trim();
              return owner.isEmpty() ? Optional.<String>empty() : Optional.of(owner);
            })
        .exceptionally(
            ex -> {
              logger.debug(
                  "Live owner query for '{}' did not complete: {}",
                  containerName,
                  ex.getMessage());
              return Optional.empty();
            });
  }
}
