package io.github.randomcodespace.appliance.tools;

import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.utils.ProcessExecutor;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public class NixosContainerCli extends AbstractCliTool {

  public NixosContainerCli(DetectedToolInfo toolInfo, ProcessExecutor processExecutor) {
    super(toolInfo, processExecutor);
  }

  @Override
  public HostTool getToolType() {
    return HostTool.NIXOS_CONTAINER;
  }

  public CompletableFuture<ExecutionResult> start(String name, Duration timeout) {
    return executeCliCommand(List.of("start", name), timeout);
  }

  public CompletableFuture<ExecutionResult> stop(String name, Duration timeout) {
    return executeCliCommand(List.of("stop", name), timeout);
  }

  /** Runs {@code command} inside the named container. Fails when the container is not running. */
  public CompletableFuture<ExecutionResult> run(
      String name, List<String> command, Duration timeout) {
    List<String> args = new ArrayList<>(List.of("run", name, "--"));
    args.addAll(command);
    return executeCliCommand(args, timeout);
  }

  /** One configured container name per line, running or not. */
  public CompletableFuture<ExecutionResult> list(Duration timeout) {
    return executeCliCommand(List.of("list"), timeout);
  }
}
