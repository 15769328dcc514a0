package io.github.randomcodespace.appliance.utils;

import io.github.randomcodespace.appliance.exceptions.CommandExecutionException;
import io.github.randomcodespace.appliance.exceptions.CommandTimeoutException;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs external processes with a hard time bound. Stream consumption happens on separate tasks so
 * a chatty process can never block on a full pipe. On timeout the process is killed and the
 * returned future fails with {@link CommandTimeoutException}.
 */
public class ProcessExecutor implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(ProcessExecutor.class);

  private final Executor executor;
  private final boolean ownsExecutor;

  /** Represents the result of a process execution. Output is trimmed. */
  public record ExecutionResult(int exitCode, String stdout, String stderr) {
    public boolean succeeded() {
      return exitCode == 0;
    }

    /** STDERR when present, otherwise STDOUT. */
    public String errorDetail() {
      return stderr == null || stderr.isEmpty() ? stdout : stderr;
    }
  }

  public ProcessExecutor() {
    this(Executors.newCachedThreadPool(), true);
  }

  protected ProcessExecutor(Executor executor) {
    this(executor, false);
  }

  private ProcessExecutor(Executor executor, boolean ownsExecutor) {
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
  }

  public CompletableFuture<ExecutionResult> execute(List<String> command, Duration timeout) {
    return execute(command, timeout, null);
  }

  /**
   * Executes a command and returns its result asynchronously.
   *
   * @param command The command and its arguments.
   * @param timeout Upper bound on the process lifetime.
   * @param workingDirectory Directory to run in, or null to inherit the current one.
   * @return A CompletableFuture holding the ExecutionResult. It fails with {@link
   *     CommandTimeoutException} when the bound is exceeded and with {@link
   *     CommandExecutionException} when the process cannot be started.
   */
  public CompletableFuture<ExecutionResult> execute(
      List<String> command, Duration timeout, Path workingDirectory) {
    return CompletableFuture.supplyAsync(
        () -> {
          String commandLine = String.join(" ", command);
          logger.debug("Executing command (timeout {}s): {}", timeout.toSeconds(), commandLine);
          ProcessBuilder processBuilder = new ProcessBuilder(command);
          if (workingDirectory != null) {
            processBuilder.directory(workingDirectory.toFile());
          }
          try {
            Process process = processBuilder.start();

            StringBuilder stdoutBuilder = new StringBuilder();
            StringBuilder stderrBuilder = new StringBuilder();
            CompletableFuture<Void> stdoutFuture =
                consumeStream(process.getInputStream(), stdoutBuilder::append);
            CompletableFuture<Void> stderrFuture =
                consumeStream(process.getErrorStream(), stderrBuilder::append);

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
              process.destroyForcibly();
              process.waitFor();
              logger.warn("Command killed after {}s: {}", timeout.toSeconds(), commandLine);
              throw new CommandTimeoutException(command, timeout);
            }
            CompletableFuture.allOf(stdoutFuture, stderrFuture).join();
            int exitCode = process.exitValue();

            String stdout = stdoutBuilder.toString().trim();
            String stderr = stderrBuilder.toString().trim();

            if (exitCode != 0) {
              logger.warn(
                  "Command failed with exit code {}: {}. Stderr: {}",
                  exitCode,
                  commandLine,
                  stderr);
            } else {
              logger.debug(
                  "Command succeeded: {}. Stdout: {}",
                  commandLine,
                  stdout.length() > 100 ? stdout.substring(0, 100) + "..." : stdout);
            }
            return new ExecutionResult(exitCode, stdout, stderr);

          } catch (IOException e) {
            logger.error("IOException during command execution: {}", commandLine, e);
            throw new CommandExecutionException(
                "I/O error executing command: " + e.getMessage(), -1, "", e);
          } catch (InterruptedException e) {
            logger.error("Command execution interrupted: {}", commandLine, e);
            Thread.currentThread().interrupt();
            throw new CommandExecutionException(
                "Command execution interrupted: " + e.getMessage(), -1, "", e);
          }
        },
        executor);
  }

  private CompletableFuture<Void> consumeStream(
      InputStream inputStream, Consumer<String> lineConsumer) {
    return CompletableFuture.runAsync(
        () -> {
          try (BufferedReader reader =
              new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
              lineConsumer.accept(line + "\n");
            }
          } catch (IOException e) {
            // Expected when a timed-out process is killed while we read.
            logger.trace("Stream closed while consuming process output: {}", e.getMessage());
          }
        },
        executor);
  }

  @Override
  public void close() {
    if (ownsExecutor && executor instanceof ExecutorService) {
      ((ExecutorService) executor).shutdownNow();
    }
  }
}
