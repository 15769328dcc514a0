package io.github.randomcodespace.appliance.exceptions;

public class ModuleDiscoveryException extends ApplianceException {
  public ModuleDiscoveryException(String message) {
    super(message);
  }

  public ModuleDiscoveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
