package io.github.randomcodespace.appliance.tools;

import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.utils.ProcessExecutor;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public class MachinectlCli extends AbstractCliTool {

  public MachinectlCli(DetectedToolInfo toolInfo, ProcessExecutor processExecutor) {
    super(toolInfo, processExecutor);
  }

  @Override
  public HostTool getToolType() {
    return HostTool.MACHINECTL;
  }

  /** JSON array of the machines currently registered with systemd-machined. */
  public CompletableFuture<ExecutionResult> list(Duration timeout) {
    return executeCliCommand(List.of("list", "--output=json", "--no-pager"), timeout);
  }
}
