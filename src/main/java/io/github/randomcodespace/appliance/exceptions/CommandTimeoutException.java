package io.github.randomcodespace.appliance.exceptions;

import java.time.Duration;
import java.util.List;

/**
 * Raised when an external command exceeds its time bound. The process has already been killed
 * when this is thrown. This is the only failure that lifecycle operations propagate to callers
 * instead of folding it into a result value.
 */
public class CommandTimeoutException extends ApplianceException {
  private final List<String> command;
  private final Duration timeout;

  public CommandTimeoutException(List<String> command, Duration timeout) {
    super("Command timed out after " + timeout.toSeconds() + "s: " + String.join(" ", command));
    this.command = List.copyOf(command);
    this.timeout = timeout;
  }

  public List<String> getCommand() {
    return command;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
