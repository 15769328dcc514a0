package io.github.randomcodespace.appliance.exceptions;

/** The runtime's machine inventory could not be queried or parsed. */
public class WorkloadListingException extends ApplianceException {
  public WorkloadListingException(String message) {
    super(message);
  }

  public WorkloadListingException(String message, Throwable cause) {
    super(message, cause);
  }
}
