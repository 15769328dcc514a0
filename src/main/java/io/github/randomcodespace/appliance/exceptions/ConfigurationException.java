package io.github.randomcodespace.appliance.exceptions;

public class ConfigurationException extends ApplianceException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
