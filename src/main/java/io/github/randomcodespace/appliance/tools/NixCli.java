package io.github.randomcodespace.appliance.tools;

import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.utils.ProcessExecutor;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public class NixCli extends AbstractCliTool {

  public NixCli(DetectedToolInfo toolInfo, ProcessExecutor processExecutor) {
    super(toolInfo, processExecutor);
  }

  @Override
  public HostTool getToolType() {
    return HostTool.NIX;
  }

  /**
   * Evaluates a flake attribute to JSON. {@code --no-update-lock-file} keeps nix from rewriting
   * {@code flake.lock}, which lives in a read-only location on the appliance.
   *
   * @return stdout of the evaluation.
   */
  public CompletableFuture<String> evalJson(String attribute, Path flakePath, Duration timeout) {
    return executeCliCommand(
            List.of("eval", attribute, "--json", "--no-update-lock-file"), timeout, flakePath)
        .thenApply(result -> handleCliResponse(result, "nix eval " + attribute + " succeeded."));
  }
}
