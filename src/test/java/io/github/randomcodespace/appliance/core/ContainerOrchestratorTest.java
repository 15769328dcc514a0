package io.github.randomcodespace.appliance.core;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import io.github.randomcodespace.appliance.builder.ModuleCatalog;
import io.github.randomcodespace.appliance.builder.SpecBuilder;
import io.github.randomcodespace.appliance.config.ApplianceSettings;
import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.dto.ContainerSpec;
import io.github.randomcodespace.appliance.dto.LifecycleResult;
import io.github.randomcodespace.appliance.enums.FailureKind;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.exceptions.CommandTimeoutException;
import io.github.randomcodespace.appliance.storage.StorageProvisioner;
import io.github.randomcodespace.appliance.testutils.FakeZfs;
import io.github.randomcodespace.appliance.testutils.LogCapture;
import io.github.randomcodespace.appliance.testutils.ScriptedProcessExecutor;
import io.github.randomcodespace.appliance.tools.ExtraContainerCli;
import io.github.randomcodespace.appliance.tools.NixCli;
import io.github.randomcodespace.appliance.tools.NixosContainerCli;
import io.github.randomcodespace.appliance.tools.ZfsCli;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ContainerOrchestratorTest {

  private static final Path FLAKE = Path.of("/var/lib/appliance");
  private static final String OWNER = "123";
  private static final String WORKSPACE = "/tank/123/containers/dev/workspace";

  @TempDir Path expressionDir;
  @Mock SpecBuilder specBuilder;

  private ScriptedProcessExecutor executor;
  private FakeZfs zfs;
  private ApplianceSettings settings;
  private LogCapture orchestratorLogs;
  private LogCapture classifierLogs;
  private final List<String> expressionsSeen = new ArrayList<>();

  @BeforeEach
  void setUp() {
    executor = new ScriptedProcessExecutor();
    zfs = new FakeZfs("tank");
    executor.when("zfs").thenAnswer(zfs);
    executor
        .when("extra-container", "create")
        .thenAnswer(
            command -> {
              expressionsSeen.add(read(Path.of(command.get(3))));
              return new ExecutionResult(0, "Installing containers:\ndev", "");
            });
    settings =
        ApplianceSettings.builder().flakePath(FLAKE).expressionDirectory(expressionDir).build();
    lenient().when(specBuilder.build(any(), any())).thenReturn("{ generated = true; }");
    orchestratorLogs = new LogCapture(ContainerOrchestrator.class);
    classifierLogs = new LogCapture(InstallOutputClassifier.class);
  }

  @AfterEach
  void tearDown() {
    orchestratorLogs.close();
    classifierLogs.close();
  }

  private static String read(Path file) {
    try {
      return Files.readString(file);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private ContainerOrchestrator orchestrator(ModuleCatalog catalog) {
    ZfsCli zfsCli =
        new ZfsCli(
            DetectedToolInfo.onPath(HostTool.ZFS),
            executor,
            Duration.ofSeconds(10),
            Duration.ofSeconds(30));
    return new ContainerOrchestrator(
        new StorageProvisioner(zfsCli, settings),
        specBuilder,
        new ExtraContainerCli(DetectedToolInfo.onPath(HostTool.EXTRA_CONTAINER), executor),
        new NixosContainerCli(DetectedToolInfo.onPath(HostTool.NIXOS_CONTAINER), executor),
        new InstallOutputClassifier(),
        catalog,
        settings);
  }

  private ContainerOrchestrator orchestrator() {
    return orchestrator(null);
  }

  private static ContainerSpec spec(String... modules) {
    return ContainerSpec.builder().name("dev").owner(OWNER).modules(List.of(modules)).build();
  }

  private List<String> expressionFiles() throws IOException {
    try (Stream<Path> files = Files.list(expressionDir)) {
      return files.map(Path::toString).collect(Collectors.toList());
    }
  }

  @Test
  void provisionsStorageThenBuildsWithWorkspacePath() throws IOException {
    LifecycleResult result = orchestrator().create(spec("git"), FLAKE).join();

    assertTrue(result.isSuccess(), result.toString());
    assertEquals("dev", result.getName());
    ArgumentCaptor<ContainerSpec> captor = ArgumentCaptor.forClass(ContainerSpec.class);
    verify(specBuilder).build(captor.capture(), eq(FLAKE));
    assertEquals(WORKSPACE, captor.getValue().getWorkspacePath().orElseThrow());
    assertTrue(zfs.exists("tank/123/containers/dev/workspace"));

    List<String> lines = executor.commandLines();
    String build = executor.commandLinesStartingWith("extra-container create --start").get(0);
    assertTrue(build.endsWith(".nix"));
    assertEquals(lines.size() - 1, lines.indexOf(build), "build runs after storage");
    assertEquals(List.of("{ generated = true; }"), expressionsSeen);
    assertTrue(expressionFiles().isEmpty(), "expression file is removed");
  }

  @Test
  void provisioningFailureNeverInvokesBuildTool() {
    zfs.failOn("set", "tank/123", "quota exceeded");

    LifecycleResult result = orchestrator().create(spec("git"), FLAKE).join();

    assertFalse(result.isSuccess());
    assertEquals(FailureKind.PROVISIONING, result.getFailureKind().orElseThrow());
    assertEquals("quota exceeded", result.getError().orElseThrow());
    assertTrue(result.getMessage().contains("provisioning"));
    assertFalse(executor.wasCalled("extra-container"));
    verify(specBuilder, never()).build(any(), any());
  }

  @Test
  void pureBuildFailureRollsBackStorage() {
    executor.when("extra-container", "create").thenFail("error: build of '/nix/store/x' failed");

    LifecycleResult result = orchestrator().create(spec("git"), FLAKE).join();

    assertFalse(result.isSuccess());
    assertEquals(FailureKind.BUILD_FAILURE, result.getFailureKind().orElseThrow());
    assertEquals("error: build of '/nix/store/x' failed", result.getError().orElseThrow());
    assertTrue(executor.wasCalled("zfs destroy -r tank/123/containers/dev"));
    assertFalse(zfs.exists("tank/123/containers/dev"));
    assertTrue(zfs.exists("tank/123"));
    assertTrue(classifierLogs.messages(Level.WARN).isEmpty());
  }

  @Test
  void partialInstallKeepsStorage() {
    executor
        .when("extra-container", "create")
        .thenReturn(1, "Installing containers:\ndev", "Job for container@dev.service failed");

    LifecycleResult result = orchestrator().create(spec("git"), FLAKE).join();

    assertFalse(result.isSuccess());
    assertEquals(FailureKind.PARTIAL_INSTALL, result.getFailureKind().orElseThrow());
    assertEquals("Job for container@dev.service failed", result.getError().orElseThrow());
    assertFalse(executor.wasCalled("zfs destroy"));
    assertTrue(zfs.exists(WORKSPACE.substring(1)));
    assertTrue(classifierLogs.messages(Level.WARN).isEmpty());
  }

  @Test
  void unrecognizedOutputWarnsAndRollsBack() {
    executor.when("extra-container", "create").thenReturn(1, "warning: something odd", "");

    LifecycleResult result = orchestrator().create(spec("git"), FLAKE).join();

    assertEquals(FailureKind.BUILD_FAILURE, result.getFailureKind().orElseThrow());
    assertEquals("warning: something odd", result.getError().orElseThrow());
    assertTrue(executor.wasCalled("zfs destroy -r tank/123/containers/dev"));
    assertEquals(1, classifierLogs.messages(Level.WARN).size());
    assertTrue(classifierLogs.contains(Level.WARN, "heuristic mismatch"));
  }

  @Test
  void failedRollbackIsLoggedAndDoesNotChangeResult() {
    executor.when("extra-container", "create").thenFail("error: evaluation aborted");
    zfs.failOn("destroy", "tank/123/containers/dev", "dataset is busy");

    LifecycleResult result = orchestrator().create(spec("git"), FLAKE).join();

    assertEquals(FailureKind.BUILD_FAILURE, result.getFailureKind().orElseThrow());
    assertEquals("error: evaluation aborted", result.getError().orElseThrow());
    assertTrue(orchestratorLogs.contains(Level.ERROR, "orphaned ZFS dataset"));
  }

  @Test
  void rollbackTimeoutIsLoggedAndDoesNotChangeResult() {
    executor.when("extra-container", "create").thenFail("error: evaluation aborted");
    executor.when("zfs", "destroy").thenTimeout();

    LifecycleResult result = orchestrator().create(spec("git"), FLAKE).join();

    assertEquals(FailureKind.BUILD_FAILURE, result.getFailureKind().orElseThrow());
    assertTrue(orchestratorLogs.contains(Level.ERROR, "orphaned ZFS dataset"));
  }

  @Test
  void buildTimeoutPropagatesAndRemovesExpressionFile() throws IOException {
    executor.when("extra-container", "create").thenTimeout();

    CompletionException e =
        assertThrows(
            CompletionException.class, () -> orchestrator().create(spec("git"), FLAKE).join());

    assertInstanceOf(CommandTimeoutException.class, e.getCause());
    assertTrue(expressionFiles().isEmpty());
  }

  @Test
  void enrollmentModuleWithoutAnyTokenIsRejectedBeforeSideEffects() {
    LifecycleResult result = orchestrator().create(spec("git", "tailscale"), FLAKE).join();

    assertFalse(result.isSuccess());
    assertEquals(FailureKind.VALIDATION, result.getFailureKind().orElseThrow());
    assertTrue(result.getError().orElseThrow().contains(ApplianceSettings.ENROLLMENT_TOKEN_ENV));
    assertTrue(executor.invocations().isEmpty());
  }

  @Test
  void settingsTokenIsInjectedForEnrollmentModule() {
    settings = settings.toBuilder().enrollmentToken("tskey-settings").build();

    orchestrator().create(spec("tailscale"), FLAKE).join();

    ArgumentCaptor<ContainerSpec> captor = ArgumentCaptor.forClass(ContainerSpec.class);
    verify(specBuilder).build(captor.capture(), eq(FLAKE));
    assertEquals("tskey-settings", captor.getValue().getEnrollmentToken().orElseThrow());
  }

  @Test
  void buildFailureWithInjectedTokenStillRollsBack() {
    settings = settings.toBuilder().enrollmentToken("tskey-settings").build();
    executor.when("extra-container", "create").thenFail("error: evaluation aborted");

    LifecycleResult result = orchestrator().create(spec("tailscale"), FLAKE).join();

    assertEquals(FailureKind.BUILD_FAILURE, result.getFailureKind().orElseThrow());
    assertTrue(executor.wasCalled("zfs destroy -r tank/123/containers/dev"));
    ArgumentCaptor<ContainerSpec> captor = ArgumentCaptor.forClass(ContainerSpec.class);
    verify(specBuilder).build(captor.capture(), eq(FLAKE));
    assertEquals("tskey-settings", captor.getValue().getEnrollmentToken().orElseThrow());
  }

  @Test
  void specTokenWinsOverSettingsToken() {
    settings = settings.toBuilder().enrollmentToken("tskey-settings").build();
    ContainerSpec spec = spec("tailscale").withEnrollmentToken("tskey-request");

    orchestrator().create(spec, FLAKE).join();

    ArgumentCaptor<ContainerSpec> captor = ArgumentCaptor.forClass(ContainerSpec.class);
    verify(specBuilder).build(captor.capture(), eq(FLAKE));
    assertEquals("tskey-request", captor.getValue().getEnrollmentToken().orElseThrow());
  }

  @Test
  void settingsTokenIsNotLeakedToOtherModules() {
    settings = settings.toBuilder().enrollmentToken("tskey-settings").build();

    orchestrator().create(spec("git"), FLAKE).join();

    ArgumentCaptor<ContainerSpec> captor = ArgumentCaptor.forClass(ContainerSpec.class);
    verify(specBuilder).build(captor.capture(), eq(FLAKE));
    assertTrue(captor.getValue().getEnrollmentToken().isEmpty());
  }

  @Test
  void unknownModulesAreRejectedWhenCatalogIsAvailable() {
    executor.when("nix", "eval").thenSucceed("[\"fish\",\"git\",\"workspace\"]");
    ModuleCatalog catalog =
        new ModuleCatalog(
            new NixCli(DetectedToolInfo.onPath(HostTool.NIX), executor),
            FLAKE,
            Duration.ofSeconds(120));

    LifecycleResult result = orchestrator(catalog).create(spec("git", "emacs"), FLAKE).join();

    assertEquals(FailureKind.VALIDATION, result.getFailureKind().orElseThrow());
    assertTrue(result.getError().orElseThrow().startsWith("Unknown modules: emacs."));
    assertFalse(executor.wasCalled("zfs"));
  }

  @Test
  void moduleDiscoveryFailureDoesNotBlockCreation() {
    executor.when("nix", "eval").thenFail("error: cannot evaluate");
    ModuleCatalog catalog =
        new ModuleCatalog(
            new NixCli(DetectedToolInfo.onPath(HostTool.NIX), executor),
            FLAKE,
            Duration.ofSeconds(120));

    LifecycleResult result = orchestrator(catalog).create(spec("git"), FLAKE).join();

    assertTrue(result.isSuccess());
    assertTrue(orchestratorLogs.contains(Level.WARN, "Module discovery failed"));
  }

  @Test
  void sameNameCallsAreSerialized() {
    CompletableFuture<ExecutionResult> gate = new CompletableFuture<>();
    executor.when("extra-container", "create").thenAnswerAsync(command -> gate);
    ContainerOrchestrator orchestrator = orchestrator();

    CompletableFuture<LifecycleResult> create = orchestrator.create(spec("git"), FLAKE);
    CompletableFuture<LifecycleResult> start = orchestrator.start("dev");
    CompletableFuture<LifecycleResult> other = orchestrator.start("web");

    assertTrue(other.join().isSuccess());
    assertFalse(start.isDone());
    assertFalse(executor.wasCalled("nixos-container start dev"));

    gate.complete(new ExecutionResult(0, "", ""));

    assertTrue(create.join().isSuccess());
    assertTrue(start.join().isSuccess());
    List<String> lines = executor.commandLines();
    assertTrue(
        lines.indexOf("nixos-container start dev")
            > lines.indexOf(
                executor.commandLinesStartingWith("extra-container create").get(0)));
  }

  @Test
  void logsOutThenDestroysContainerThenStorage() {
    orchestrator().create(spec("git"), FLAKE).join();

    LifecycleResult result = orchestrator().destroy("dev", OWNER).join();

    assertTrue(result.isSuccess(), result.toString());
    assertTrue(result.getMessage().contains("dev"));
    List<String> lines = executor.commandLines();
    int logout = lines.indexOf("nixos-container run dev -- tailscale logout");
    int destroy = lines.indexOf("extra-container destroy dev");
    int storage = lines.indexOf("zfs destroy -r tank/123/containers/dev");
    assertTrue(logout >= 0 && logout < destroy && destroy < storage, lines.toString());
    assertFalse(zfs.exists("tank/123/containers/dev"));
    assertTrue(zfs.exists("tank/123"));
  }

  @Test
  void withoutOwnerStorageIsKept() {
    LifecycleResult result = orchestrator().destroy("dev", null).join();

    assertTrue(result.isSuccess());
    assertFalse(executor.wasCalled("zfs"));
  }

  @Test
  void destroyFailureLeavesStorageAlone() {
    executor.when("extra-container", "destroy").thenFail("error: container 'dev' is not known");

    LifecycleResult result = orchestrator().destroy("dev", OWNER).join();

    assertFalse(result.isSuccess());
    assertEquals(FailureKind.DESTROY_FAILURE, result.getFailureKind().orElseThrow());
    assertTrue(result.getError().orElseThrow().contains("not known"));
    assertFalse(executor.wasCalled("zfs"));
    assertTrue(orchestratorLogs.contains(Level.ERROR, "destroy_container failed"));
    assertTrue(orchestratorLogs.contains(Level.ERROR, "dev"));
  }

  @Test
  void storageCleanupFailureStillReportsSuccess() {
    zfs.put("tank/123", true);
    zfs.put("tank/123/containers", true);
    zfs.put("tank/123/containers/dev", true);
    zfs.failOn("destroy", "tank/123/containers/dev", "dataset is busy");

    LifecycleResult result = orchestrator().destroy("dev", OWNER).join();

    assertTrue(result.isSuccess());
    assertTrue(result.getMessage().toLowerCase().contains("storage cleanup failed"));
    assertEquals("dataset is busy", result.getError().orElseThrow());
    assertTrue(orchestratorLogs.contains(Level.ERROR, "ZFS cleanup failed"));
  }

  @Test
  void logoutFailureIsOnlyDebug() {
    executor.when("nixos-container", "run").thenFail("container is not running");

    LifecycleResult result = orchestrator().destroy("dev", null).join();

    assertTrue(result.isSuccess());
    assertTrue(executor.wasCalled("extra-container destroy dev"));
    assertTrue(orchestratorLogs.contains(Level.DEBUG, "logout"));
    assertTrue(
        orchestratorLogs.messages(Level.ERROR).stream()
            .noneMatch(message -> message.toLowerCase().contains("logout")));
  }

  @Test
  void logoutTimeoutDoesNotStopDestroy() {
    executor.when("nixos-container", "run").thenTimeout();

    LifecycleResult result = orchestrator().destroy("dev", null).join();

    assertTrue(result.isSuccess());
    assertEquals(1, executor.commandLinesStartingWith("extra-container destroy dev").size());
    assertTrue(orchestratorLogs.messages(Level.ERROR).isEmpty());
  }

  @Test
  void startRunsNixosContainerStart() {
    LifecycleResult result = orchestrator().start("dev").join();

    assertTrue(result.isSuccess());
    assertTrue(result.getMessage().contains("dev"));
    assertEquals(List.of("nixos-container start dev"), executor.commandLines());
  }

  @Test
  void startFailureSurfacesToolError() {
    executor.when("nixos-container", "start").thenFail("Container dev is already running.");

    LifecycleResult result = orchestrator().start("dev").join();

    assertFalse(result.isSuccess());
    assertEquals(FailureKind.START_FAILURE, result.getFailureKind().orElseThrow());
    assertEquals("Container dev is already running.", result.getError().orElseThrow());
    assertTrue(orchestratorLogs.contains(Level.ERROR, "start_container failed for 'dev'"));
  }

  @Test
  void stopRunsNixosContainerStop() {
    LifecycleResult result = orchestrator().stop("dev").join();

    assertTrue(result.isSuccess());
    assertTrue(result.getMessage().contains("dev"));
    assertEquals(List.of("nixos-container stop dev"), executor.commandLines());
  }

  @Test
  void stopFailureSurfacesToolError() {
    executor.when("nixos-container", "stop").thenReturn(1, "stop error on stdout", "");

    LifecycleResult result = orchestrator().stop("dev").join();

    assertEquals(FailureKind.STOP_FAILURE, result.getFailureKind().orElseThrow());
    assertEquals("stop error on stdout", result.getError().orElseThrow());
    assertTrue(orchestratorLogs.contains(Level.ERROR, "stop_container failed for 'dev'"));
  }

  @Test
  void invalidNamesAreRejectedWithoutSideEffects() {
    for (String name : List.of("-bad", "MyDev", "my-dev-container")) {
      assertEquals(
          FailureKind.VALIDATION,
          orchestrator().start(name).join().getFailureKind().orElseThrow());
      assertEquals(
          FailureKind.VALIDATION,
          orchestrator().stop(name).join().getFailureKind().orElseThrow());
      assertEquals(
          FailureKind.VALIDATION,
          orchestrator().destroy(name, OWNER).join().getFailureKind().orElseThrow());
    }
    assertTrue(executor.invocations().isEmpty());
  }
}
