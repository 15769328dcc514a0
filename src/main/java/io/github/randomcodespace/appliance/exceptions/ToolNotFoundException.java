package io.github.randomcodespace.appliance.exceptions;

public class ToolNotFoundException extends ApplianceException {
  public ToolNotFoundException(String message) {
    super(message);
  }

  public ToolNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
