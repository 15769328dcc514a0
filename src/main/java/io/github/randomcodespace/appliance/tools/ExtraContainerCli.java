package io.github.randomcodespace.appliance.tools;

import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.utils.ProcessExecutor;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** The declarative build/install tool. */
public class ExtraContainerCli extends AbstractCliTool {

  public ExtraContainerCli(DetectedToolInfo toolInfo, ProcessExecutor processExecutor) {
    super(toolInfo, processExecutor);
  }

  @Override
  public HostTool getToolType() {
    return HostTool.EXTRA_CONTAINER;
  }

  /** Builds, installs and starts the containers defined in {@code expressionFile}. */
  public CompletableFuture<ExecutionResult> createAndStart(Path expressionFile, Duration timeout) {
    return executeCliCommand(List.of("create", "--start", expressionFile.toString()), timeout);
  }

  public CompletableFuture<ExecutionResult> destroy(String name, Duration timeout) {
    return executeCliCommand(List.of("destroy", name), timeout);
  }
}
