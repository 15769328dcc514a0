package io.github.randomcodespace.appliance.tools;

import io.github.randomcodespace.appliance.detection.DetectedToolInfo;
import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.exceptions.ApplianceException;
import io.github.randomcodespace.appliance.exceptions.CommandExecutionException;
import io.github.randomcodespace.appliance.exceptions.CommandTimeoutException;
import io.github.randomcodespace.appliance.utils.ProcessExecutor;
import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for wrappers around one host CLI tool. Commands that cannot even be launched (missing
 * binary, permission denied) come back as a failed {@link ExecutionResult} with exit code -1, so
 * callers only ever see a result value or a {@link CommandTimeoutException}.
 */
public abstract class AbstractCliTool {
  private static final Logger logger = LoggerFactory.getLogger(AbstractCliTool.class);

  public static final int LAUNCH_FAILURE_EXIT_CODE = -1;

  protected final Path executablePath;
  protected final ProcessExecutor processExecutor;

  protected AbstractCliTool(DetectedToolInfo toolInfo, ProcessExecutor processExecutor) {
    if (toolInfo == null || toolInfo.getExecutablePath() == null) {
      throw new ApplianceException(
          "ToolInfo and executable path must not be null for CLI tool initialization.");
    }
    if (toolInfo.getToolType() != getToolType()) {
      throw new ApplianceException(
          "Attempting to initialize "
              + getToolType()
              + " wrapper with ToolInfo for "
              + toolInfo.getToolType());
    }
    this.executablePath = toolInfo.getExecutablePath();
    this.processExecutor = processExecutor;
  }

  public abstract HostTool getToolType();

  protected CompletableFuture<ExecutionResult> executeCliCommand(
      List<String> arguments, Duration timeout) {
    return executeCliCommand(arguments, timeout, null);
  }

  /**
   * Executes a CLI command for this tool.
   *
   * @param arguments Arguments, excluding the executable itself.
   * @param timeout Bound after which the process is killed.
   * @param workingDirectory Directory to run in, or null.
   * @return A CompletableFuture holding the execution result.
   */
  protected CompletableFuture<ExecutionResult> executeCliCommand(
      List<String> arguments, Duration timeout, Path workingDirectory) {
    List<String> command = new ArrayList<>();
    command.add(executablePath.toString());
    command.addAll(arguments);
    return processExecutor
        .execute(command, timeout, workingDirectory)
        .exceptionally(ex -> recoverLaunchFailure(command, ex));
  }

  private ExecutionResult recoverLaunchFailure(List<String> command, Throwable ex) {
    Throwable cause =
        ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    if (cause instanceof CommandTimeoutException) {
      throw (CommandTimeoutException) cause;
    }
    logger.error("{} could not be executed: {}", String.join(" ", command), cause.getMessage());
    String detail =
        cause instanceof CommandExecutionException
            ? ((CommandExecutionException) cause).getCommandOutput()
            : "";
    return new ExecutionResult(
        LAUNCH_FAILURE_EXIT_CODE,
        "",
        detail == null || detail.isEmpty() ? String.valueOf(cause.getMessage()) : detail);
  }

  /**
   * Returns stdout of a successful command, or throws for a failed one.
   *
   * @throws CommandExecutionException if the command exited non-zero.
   */
  protected String handleCliResponse(ExecutionResult result, String successMessage)
      throws CommandExecutionException {
    if (result.succeeded()) {
      logger.debug(
          "{} STDOUT: {}",
          successMessage,
          result.stdout().length() > 100
              ? result.stdout().substring(0, 100) + "..."
              : result.stdout());
      return result.stdout();
    }
    String errorMessage =
        String.format(
            "%s command failed with exit code %d. STDERR: %s. STDOUT: %s",
            getToolType(), result.exitCode(), result.stderr(), result.stdout());
    logger.error(errorMessage);
    throw new CommandExecutionException(errorMessage, result.exitCode(), result.errorDetail());
  }
}
