package io.github.randomcodespace.appliance.ownership;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.dto.ContainerSummary;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.exceptions.WorkloadListingException;
import io.github.randomcodespace.appliance.testutils.ScriptedProcessExecutor;
import io.github.randomcodespace.appliance.tools.MachinectlCli;
import io.github.randomcodespace.appliance.tools.NixosContainerCli;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OwnershipResolverTest {

  private static final String MACHINES =
      "[{\"machine\":\"dev\",\"class\":\"container\",\"service\":\"nspawn\","
          + "\"os\":\"nixos\",\"version\":\"24.11\",\"addresses\":\"10.100.0.2\\n\"},"
          + "{\"machine\":\"winvm\",\"class\":\"vm\",\"service\":\"libvirt\"}]";

  @Mock OwnerDiscovery live;
  @Mock OwnerDiscovery closure;

  private ScriptedProcessExecutor executor;
  private OwnershipResolver resolver;

  @BeforeEach
  void setUp() {
    executor = new ScriptedProcessExecutor();
    executor.when("machinectl", "list").thenSucceed(MACHINES);
    executor.when("nixos-container", "list").thenSucceed("dev\nweb\n");
    lenient().when(live.name()).thenReturn("live");
    lenient().when(closure.name()).thenReturn("closure");
    resolver =
        new OwnershipResolver(
            new MachinectlCli(DetectedToolInfo.onPath(HostTool.MACHINECTL), executor),
            new NixosContainerCli(DetectedToolInfo.onPath(HostTool.NIXOS_CONTAINER), executor),
            live,
            closure,
            Duration.ofSeconds(15),
            Duration.ofSeconds(10));
  }

  private static CompletableFuture<Optional<String>> owner(String owner) {
    return CompletableFuture.completedFuture(Optional.ofNullable(owner));
  }

  private static List<String> names(List<ContainerSummary> summaries) {
    return summaries.stream().map(ContainerSummary::getName).collect(Collectors.toList());
  }

  @Test
  void liveAnswerWinsAndStopsTheChain() {
    when(live.discover("dev")).thenReturn(owner("123"));

    assertEquals(Optional.of("123"), resolver.resolveOwner("dev").join());
    verify(closure, never()).discover(anyString());
  }

  @Test
  void fallsBackToSystemClosure() {
    when(live.discover("dev")).thenReturn(owner(null));
    when(closure.discover("dev")).thenReturn(owner("456"));

    assertEquals(Optional.of("456"), resolver.resolveOwner("dev").join());
  }

  @Test
  void unresolvableOwnerIsEmpty() {
    when(live.discover("dev")).thenReturn(owner(null));
    when(closure.discover("dev")).thenReturn(owner(null));

    assertTrue(resolver.resolveOwner("dev").join().isEmpty());
    assertFalse(resolver.isOwnedBy("dev", "123").join());
  }

  @Test
  void invalidNameHasNoOwnerAndIsNeverLookedUp() {
    assertTrue(resolver.resolveOwner("../../home/x/y").join().isEmpty());
    assertFalse(resolver.isOwnedBy("../../home/x/y", "123").join());
    verify(live, never()).discover(anyString());
    verify(closure, never()).discover(anyString());
  }

  @Test
  void isOwnedByComparesExactly() {
    when(live.discover("dev")).thenReturn(owner("123"));

    assertTrue(resolver.isOwnedBy("dev", "123").join());
    assertFalse(resolver.isOwnedBy("dev", "1234").join());
  }

  @Test
  void listsRunningMachinesAndStoppedContainers() {
    List<ContainerSummary> all = resolver.listAll().join();

    assertEquals(List.of("dev", "winvm", "web"), names(all));
    ContainerSummary dev = all.get(0);
    assertTrue(dev.isRunning());
    assertTrue(dev.isContainer());
    assertEquals(List.of("10.100.0.2"), dev.getAddresses());
    assertFalse(all.get(1).isContainer());
    ContainerSummary web = all.get(2);
    assertEquals(ContainerSummary.STATE_STOPPED, web.getState());
    assertTrue(web.isContainer());
    assertTrue(web.getAddresses().isEmpty());
  }

  @Test
  void filterUsesFullChainForRunningAndClosureForStopped() {
    when(live.discover("dev")).thenReturn(owner("123"));
    when(closure.discover("web")).thenReturn(owner("123"));

    List<ContainerSummary> mine = resolver.listAll("123").join();

    assertEquals(List.of("dev", "web"), names(mine));
    verify(live, never()).discover("web");
    verify(live, never()).discover("winvm");
    verify(closure, never()).discover("winvm");
  }

  @Test
  void filterDropsOtherOwnersAndUnresolved() {
    when(live.discover("dev")).thenReturn(owner(null));
    when(closure.discover("dev")).thenReturn(owner(null));
    when(closure.discover("web")).thenReturn(owner("999"));

    assertTrue(resolver.listAll("123").join().isEmpty());
  }

  @Test
  void configuredListFailureMeansNoStoppedContainers() {
    executor.when("nixos-container", "list").thenFail("permission denied");

    assertEquals(List.of("dev", "winvm"), names(resolver.listAll().join()));
  }

  @Test
  void machinectlFailureFailsTheListing() {
    executor.when("machinectl", "list").thenFail("Failed to connect to bus");

    CompletionException e =
        assertThrows(CompletionException.class, () -> resolver.listAll().join());
    assertInstanceOf(WorkloadListingException.class, e.getCause());
    assertTrue(e.getCause().getMessage().contains("Failed to connect to bus"));
  }

  @Test
  void machinectlTimeoutFailsTheListing() {
    executor.when("machinectl", "list").thenTimeout();

    CompletionException e =
        assertThrows(CompletionException.class, () -> resolver.listAll().join());
    assertInstanceOf(WorkloadListingException.class, e.getCause());
    assertTrue(e.getCause().getMessage().contains("timed out"));
  }

  @Test
  void malformedMachinectlOutputFailsTheListing() {
    executor.when("machinectl", "list").thenSucceed("{\"machine\":\"dev\"}");
    assertThrows(CompletionException.class, () -> resolver.listAll().join());

    executor.when("machinectl", "list").thenSucceed("[{\"class\":\"container\"}]");
    CompletionException e =
        assertThrows(CompletionException.class, () -> resolver.listAll().join());
    assertTrue(e.getCause().getMessage().contains("Missing 'machine'"));
  }

  @Test
  void emptyInventoryIsEmptyList() {
    executor.when("machinectl", "list").thenSucceed("[]");
    executor.when("nixos-container", "list").thenSucceed("");

    assertTrue(resolver.listAll().join().isEmpty());
  }

  @Test
  void parsesBothAddressShapes() {
    assertEquals(
        List.of("10.0.0.2", "fe80::1"), OwnershipResolver.parseAddresses("10.0.0.2\nfe80::1\n"));
    assertEquals(
        List.of("10.0.0.2"), OwnershipResolver.parseAddresses(List.of("10.0.0.2", " ")));
    assertTrue(OwnershipResolver.parseAddresses(null).isEmpty());
  }
}
