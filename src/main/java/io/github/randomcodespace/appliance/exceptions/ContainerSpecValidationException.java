package io.github.randomcodespace.appliance.exceptions;

/** A container request was malformed. Raised before any side effect takes place. */
public class ContainerSpecValidationException extends ApplianceException {
  public ContainerSpecValidationException(String message) {
    super(message);
  }
}
