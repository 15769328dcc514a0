package io.github.randomcodespace.appliance.core;

import io.github.randomcodespace.appliance.builder.ModuleCatalog;
import io.github.randomcodespace.appliance.builder.NixExpressionGenerator;
import io.github.randomcodespace.appliance.builder.SpecBuilder;
import io.github.randomcodespace.appliance.config.ApplianceSettings;
import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.detection.ToolDetector;
import io.github.randomcodespace.appliance.dto.ContainerSpec;
import io.github.randomcodespace.appliance.dto.ContainerSummary;
import io.github.randomcodespace.appliance.dto.LifecycleResult;
import io.github.randomcodespace.appliance.dto.StorageUsage;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.exceptions.ApplianceException;
import io.github.randomcodespace.appliance.exceptions.ToolNotFoundException;
import io.github.randomcodespace.appliance.ownership.OwnershipResolver;
import io.github.randomcodespace.appliance.storage.StorageProvisioner;
import io.github.randomcodespace.appliance.tools.ExtraContainerCli;
import io.github.randomcodespace.appliance.tools.MachinectlCli;
import io.github.randomcodespace.appliance.tools.NixCli;
import io.github.randomcodespace.appliance.tools.NixosContainerCli;
import io.github.randomcodespace.appliance.tools.ZfsCli;
import io.github.randomcodespace.appliance.utils.ProcessExecutor;
import java.io.Closeable;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for the appliance. Detects the host tools, wires storage, ownership and the
 * orchestrator from one {@link ApplianceSettings}, and delegates to them.
 */
public class ContainerApplianceService implements ContainerLifecycle, Closeable {
  private static final Logger logger = LoggerFactory.getLogger(ContainerApplianceService.class);

  static final List<HostTool> REQUIRED_TOOLS = Arrays.asList(HostTool.values());

  private final ApplianceSettings settings;
  private final ToolDetector toolDetector;
  private final ProcessExecutor processExecutor;
  private final SpecBuilder specBuilder;

  private boolean initialized = false;
  private StorageProvisioner storage;
  private OwnershipResolver ownership;
  private ModuleCatalog moduleCatalog;
  private ContainerOrchestrator orchestrator;

  public ContainerApplianceService(ApplianceSettings settings) {
    this(settings, new ToolDetector(), new ProcessExecutor(), new NixExpressionGenerator());
  }

  public ContainerApplianceService(
      ApplianceSettings settings,
      ToolDetector toolDetector,
      ProcessExecutor processExecutor,
      SpecBuilder specBuilder) {
    this.settings = settings;
    this.toolDetector = toolDetector;
    this.processExecutor = processExecutor;
    this.specBuilder = specBuilder;
  }

  /**
   * Detects every host tool and wires the components. Must be called before any other operation;
   * calling it again is a no-op.
   *
   * @throws ToolNotFoundException if a required host tool is missing.
   */
  public synchronized void initialize() throws ToolNotFoundException {
    if (initialized) {
      logger.info("ContainerApplianceService already initialized");
      return;
    }
    logger.info("Initializing ContainerApplianceService, detecting host tools...");
    Map<HostTool, DetectedToolInfo> tools;
    try {
      tools = toolDetector.detectAll(REQUIRED_TOOLS).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ToolNotFoundException("Interrupted while detecting host tools", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      logger.error("Host tool detection failed: {}", cause.getMessage());
      if (cause instanceof ApplianceException) {
        throw (ApplianceException) cause;
      }
      throw new ToolNotFoundException("Failed to detect host tools: " + cause.getMessage(), cause);
    }

    ZfsCli zfs =
        new ZfsCli(
            tools.get(HostTool.ZFS),
            processExecutor,
            settings.getZfsQueryTimeout(),
            settings.getZfsMutationTimeout());
    NixosContainerCli nixosContainer =
        new NixosContainerCli(tools.get(HostTool.NIXOS_CONTAINER), processExecutor);
    ExtraContainerCli extraContainer =
        new ExtraContainerCli(tools.get(HostTool.EXTRA_CONTAINER), processExecutor);
    MachinectlCli machinectl = new MachinectlCli(tools.get(HostTool.MACHINECTL), processExecutor);
    NixCli nix = new NixCli(tools.get(HostTool.NIX), processExecutor);

    this.storage = new StorageProvisioner(zfs, settings);
    this.ownership = new OwnershipResolver(machinectl, nixosContainer, settings);
    this.moduleCatalog =
        new ModuleCatalog(nix, settings.getFlakePath(), settings.getModuleDiscoveryTimeout());
    this.orchestrator =
        new ContainerOrchestrator(
            storage,
            specBuilder,
            extraContainer,
            nixosContainer,
            new InstallOutputClassifier(),
            moduleCatalog,
            settings);
    this.initialized = true;
    logger.info("ContainerApplianceService initialized with settings: {}", settings);
  }

  private void ensureInitialized() {
    if (!initialized) {
      throw new IllegalStateException(
          "ContainerApplianceService has not been initialized. Call initialize() first.");
    }
  }

  public ApplianceSettings getSettings() {
    return settings;
  }

  /** Creates a container from the configured flake. */
  public CompletableFuture<LifecycleResult> create(ContainerSpec spec) {
    return create(spec, settings.getFlakePath());
  }

  @Override
  public CompletableFuture<LifecycleResult> create(ContainerSpec spec, Path flakePath) {
    ensureInitialized();
    return orchestrator.create(spec, flakePath);
  }

  @Override
  public CompletableFuture<LifecycleResult> destroy(String name, String owner) {
    ensureInitialized();
    return orchestrator.destroy(name, owner);
  }

  @Override
  public CompletableFuture<LifecycleResult> start(String name) {
    ensureInitialized();
    return orchestrator.start(name);
  }

  @Override
  public CompletableFuture<LifecycleResult> stop(String name) {
    ensureInitialized();
    return orchestrator.stop(name);
  }

  // --- ownership ---

  public CompletableFuture<Optional<String>> resolveOwner(String name) {
    ensureInitialized();
    return ownership.resolveOwner(name);
  }

  public CompletableFuture<Boolean> isOwnedBy(String name, String owner) {
    ensureInitialized();
    return ownership.isOwnedBy(name, owner);
  }

  public CompletableFuture<List<ContainerSummary>> listContainers(String ownerFilter) {
    ensureInitialized();
    return ownership.listAll(ownerFilter);
  }

  // --- storage and modules ---

  public CompletableFuture<StorageUsage> getUserStorageInfo(String owner) {
    ensureInitialized();
    return storage.getUserStorageInfo(owner);
  }

  public CompletableFuture<List<String>> availableModules() {
    ensureInitialized();
    return moduleCatalog.availableModules();
  }

  public void invalidateModuleCache() {
    ensureInitialized();
    moduleCatalog.invalidate();
  }

  /** Shuts down the process executor. The service cannot be used afterwards. */
  @Override
  public synchronized void close() {
    processExecutor.close();
    initialized = false;
    logger.info("ContainerApplianceService closed and resources released.");
  }
}
