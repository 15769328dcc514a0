package io.github.randomcodespace.appliance.tools;

import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.utils.ProcessExecutor;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** {@code zfs} invocations used by the storage provisioner. Every dataset is fully qualified. */
public class ZfsCli extends AbstractCliTool {
  private final Duration queryTimeout;
  private final Duration mutationTimeout;

  public ZfsCli(
      DetectedToolInfo toolInfo,
      ProcessExecutor processExecutor,
      Duration queryTimeout,
      Duration mutationTimeout) {
    super(toolInfo, processExecutor);
    this.queryTimeout = queryTimeout;
    this.mutationTimeout = mutationTimeout;
  }

  @Override
  public HostTool getToolType() {
    return HostTool.ZFS;
  }

  /** Exit code 0 means the dataset exists. */
  public CompletableFuture<ExecutionResult> list(String dataset) {
    return executeCliCommand(List.of("list", "-H", "-o", "name", dataset), queryTimeout);
  }

  public CompletableFuture<ExecutionResult> create(String dataset, String mountpoint) {
    return executeCliCommand(
        List.of("create", "-o", "mountpoint=" + mountpoint, dataset), mutationTimeout);
  }

  /** Prints {@code yes} or {@code no}. */
  public CompletableFuture<ExecutionResult> getMounted(String dataset) {
    return executeCliCommand(
        List.of("get", "-H", "-o", "value", "mounted", dataset), queryTimeout);
  }

  public CompletableFuture<ExecutionResult> mount(String dataset) {
    return executeCliCommand(List.of("mount", dataset), mutationTimeout);
  }

  public CompletableFuture<ExecutionResult> setQuota(String dataset, String quota) {
    return executeCliCommand(List.of("set", "quota=" + quota, dataset), queryTimeout);
  }

  public CompletableFuture<ExecutionResult> destroyRecursive(String dataset) {
    return executeCliCommand(List.of("destroy", "-r", dataset), mutationTimeout);
  }

  /** Tab-separated {@code property value} lines with raw byte counts. */
  public CompletableFuture<ExecutionResult> getSpace(String dataset) {
    return executeCliCommand(
        List.of("get", "-Hp", "-o", "property,value", "quota,used,available", dataset),
        queryTimeout);
  }
}
