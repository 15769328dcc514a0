package io.github.randomcodespace.appliance.ownership;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.randomcodespace.appliance.builder.ContainerNames;
import io.github.randomcodespace.appliance.config.ApplianceSettings;
import io.github.randomcodespace.appliance.dto.ContainerSummary;
import io.github.randomcodespace.appliance.exceptions.CommandTimeoutException;
import io.github.randomcodespace.appliance.exceptions.WorkloadListingException;
import io.github.randomcodespace.appliance.tools.MachinectlCli;
import io.github.randomcodespace.appliance.tools.NixosContainerCli;
import io.github.randomcodespace.appliance.utils.JsonParserUtil;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers "who owns this container" and lists containers, optionally restricted to one owner.
 *
 * <p>Ownership is never cached: every call goes back to the running container or its system
 * closure. The resolver does not authorize anything itself; an empty owner means the calling
 * layer must refuse the operation.
 */
public class OwnershipResolver {
  private static final Logger logger = LoggerFactory.getLogger(OwnershipResolver.class);

  private static final TypeReference<List<Map<String, Object>>> MACHINE_LIST =
      new TypeReference<>() {};

  private final MachinectlCli machinectl;
  private final NixosContainerCli nixosContainer;
  private final List<OwnerDiscovery> chain;
  private final OwnerDiscovery stoppedStrategy;
  private final Duration inventoryTimeout;
  private final Duration configuredListTimeout;

  public OwnershipResolver(
      MachinectlCli machinectl, NixosContainerCli nixosContainer, ApplianceSettings settings) {
    this(
        machinectl,
        nixosContainer,
        new LiveEnvironmentOwnerDiscovery(
            nixosContainer, settings.getOwnerVariable(), settings.getOwnerQueryTimeout()),
        new SystemClosureOwnerDiscovery(
            settings.getContainerConfDirectory(), settings.getOwnerVariable()),
        settings.getInventoryTimeout(),
        settings.getOwnerQueryTimeout());
  }

  /**
   * @param live First strategy of the chain, used for running containers only.
   * @param stopped Last strategy of the chain, and the only one tried for stopped containers.
   */
  public OwnershipResolver(
      MachinectlCli machinectl,
      NixosContainerCli nixosContainer,
      OwnerDiscovery live,
      OwnerDiscovery stopped,
      Duration inventoryTimeout,
      Duration configuredListTimeout) {
    this.machinectl = machinectl;
    this.nixosContainer = nixosContainer;
    this.chain = List.of(live, stopped);
    this.stoppedStrategy = stopped;
    this.inventoryTimeout = inventoryTimeout;
    this.configuredListTimeout = configuredListTimeout;
  }

  /**
   * Tries each discovery strategy in order and returns the first owner found. Later strategies are
   * not consulted once one answers. A name that is not a valid container name has no owner.
   */
  public CompletableFuture<Optional<String>> resolveOwner(String name) {
    Optional<String> nameError = ContainerNames.validate(name);
    if (nameError.isPresent()) {
      logger.warn("Refusing to resolve owner of invalid container name: {}", nameError.get());
      return CompletableFuture.completedFuture(Optional.empty());
    }
    return resolveFrom(name, 0);
  }

  private CompletableFuture<Optional<String>> resolveFrom(String name, int index) {
    if (index >= chain.size()) {
      logger.debug("No owner found for container '{}'", name);
      return CompletableFuture.completedFuture(Optional.empty());
    }
    OwnerDiscovery strategy = chain.get(index);
    return strategy
        .discover(name)
        .thenCompose(
            owner -> {
              if (owner.isPresent()) {
                logger.info(
                    "Container '{}' owned by {} ({})", name, owner.get(), strategy.name());
                return CompletableFuture.completedFuture(owner);
              }
              return resolveFrom(name, index + 1);
            });
  }

  public CompletableFuture<Boolean> isOwnedBy(String name, String owner) {
    return resolveOwner(name).thenApply(resolved -> resolved.map(owner::equals).orElse(false));
  }

  public CompletableFuture<List<ContainerSummary>> listAll() {
    return listAll(null);
  }

  /**
   * Lists running machines and configured-but-stopped containers.
   *
   * @param ownerFilter When non-null, only containers resolved to this owner are returned. VMs and
   *     containers whose owner cannot be determined are dropped.
   * @return Fails with {@link WorkloadListingException} when the running inventory cannot be read.
   */
  public CompletableFuture<List<ContainerSummary>> listAll(String ownerFilter) {
    CompletableFuture<List<ContainerSummary>> inventory =
        runningMachines()
            .thenCombine(
                configuredNames(),
                (running, configured) -> {
                  Map<String, ContainerSummary> byName = new LinkedHashMap<>();
                  running.forEach(summary -> byName.put(summary.getName(), summary));
                  int stopped = 0;
                  for (String name : configured) {
                    if (!byName.containsKey(name)) {
                      byName.put(name, stoppedContainer(name));
                      stopped++;
                    }
                  }
                  logger.debug(
                      "Inventory: {} running, {} stopped", byName.size() - stopped, stopped);
                  return new ArrayList<>(byName.values());
                });
    if (ownerFilter == null) {
      return inventory;
    }
    return inventory.thenCompose(all -> filterByOwner(all, ownerFilter));
  }

  private CompletableFuture<List<ContainerSummary>> filterByOwner(
      List<ContainerSummary> all, String owner) {
    List<ContainerSummary> candidates =
        all.stream().filter(ContainerSummary::isContainer).collect(Collectors.toList());
    List<CompletableFuture<Optional<String>>> owners = new ArrayList<>();
    for (ContainerSummary summary : candidates) {
      owners.add(
          summary.isRunning()
              ? resolveOwner(summary.getName())
              : stoppedStrategy.discover(summary.getName()));
    }
    return CompletableFuture.allOf(owners.toArray(new CompletableFuture[0]))
        .thenApply(
            v -> {
              List<ContainerSummary> filtered = new ArrayList<>();
              for (int i = 0; i < candidates.size(); i++) {
                if (owners.get(i).join().filter(owner::equals).isPresent()) {
                  filtered.add(candidates.get(i));
                }
              }
              logger.info(
                  "Listed {} containers for owner {} (from {} total)",
                  filtered.size(),
                  owner,
                  all.size());
              return filtered;
            });
  }

  private CompletableFuture<List<ContainerSummary>> runningMachines() {
    return machinectl
        .list(inventoryTimeout)
        .handle(
            (result, ex) -> {
              if (ex != null) {
                Throwable cause =
                    ex instanceof CompletionException && ex.getCause() != null
                        ? ex.getCause()
                        : ex;
                if (cause instanceof CommandTimeoutException) {
                  throw new WorkloadListingException(
                      "machinectl timed out after "
                          + inventoryTimeout.toSeconds()
                          + "s, is systemd-machined responsive?",
                      cause);
                }
                throw new WorkloadListingException(
                    "machinectl could not be run: " + cause.getMessage(), cause);
              }
              return parseMachines(result);
            });
  }

  private List<ContainerSummary> parseMachines(ExecutionResult result) {
    if (!result.succeeded()) {
      throw new WorkloadListingException(
          "machinectl failed (exit " + result.exitCode() + "): " + result.errorDetail());
    }
    List<Map<String, Object>> entries =
        JsonParserUtil.fromJson(result.stdout(), MACHINE_LIST)
            .orElseThrow(
                () ->
                    new WorkloadListingException(
                        "Expected a JSON list from machinectl, got: " + result.stdout()));
    List<ContainerSummary> machines = new ArrayList<>();
    for (Map<String, Object> entry : entries) {
      Object machine = entry.get("machine");
      if (machine == null) {
        throw new WorkloadListingException("Missing 'machine' key in machinectl entry: " + entry);
      }
      machines.add(
          ContainerSummary.builder()
              .name(machine.toString())
              .machineClass(stringOr(entry, "class", ContainerSummary.CLASS_CONTAINER))
              .service(stringOr(entry, "service", "nspawn"))
              .state(stringOr(entry, "state", ContainerSummary.STATE_RUNNING))
              .addresses(parseAddresses(entry.get("addresses")))
              .build());
    }
    return machines;
  }

  /** Older machinectl releases emit a newline-separated string, newer ones a JSON array. */
  static List<String> parseAddresses(Object raw) {
    if (raw == null) {
      return List.of();
    }
    List<String> values =
        raw instanceof List
            ? ((List<?>) raw).stream().map(String::valueOf).collect(Collectors.toList())
            : Arrays.asList(raw.toString().split("\\R"));
    return values.stream()
        .map(String::trim)
        .filter(address -> !address.isEmpty())
        .collect(Collectors.toList());
  }

  private static String stringOr(Map<String, Object> entry, String key, String fallback) {
    Object value = entry.get(key);
    return value == null ? fallback : value.toString();
  }

  /** Configured containers, running or not. A failing listing counts as none configured. */
  private CompletableFuture<List<String>> configuredNames() {
    return nixosContainer
        .list(configuredListTimeout)
        .handle(
            (result, ex) -> {
              if (ex != null) {
                logger.debug("nixos-container list did not complete: {}", ex.getMessage());
                return List.<String>of();
              }
              if (!result.succeeded() || result.stdout().isEmpty()) {
                return List.<String>of();
              }
              return result
                  .stdout()
                  .lines()
                  .map(String::trim)
                  .filter(line -> !line.isEmpty())
                  .collect(Collectors.toList());
            });
  }

  private static ContainerSummary stoppedContainer(String name) {
    return ContainerSummary.builder()
        .name(name)
        .machineClass(ContainerSummary.CLASS_CONTAINER)
        .service("nspawn")
        .state(ContainerSummary.STATE_STOPPED)
        .build();
  }
}
