package io.github.randomcodespace.appliance.exceptions;

/** Root of every exception raised by the appliance library. */
public class ApplianceException extends RuntimeException {
  public ApplianceException(String message) {
    super(message);
  }

  public ApplianceException(String message, Throwable cause) {
    super(message, cause);
  }
}
