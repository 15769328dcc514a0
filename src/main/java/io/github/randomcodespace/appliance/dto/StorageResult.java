package io.github.randomcodespace.appliance.dto;

import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Outcome of a dataset operation. {@code mountPath} is set by workspace provisioning. */
@Getter
@Builder
@ToString
public class StorageResult {
  private final boolean success;
  private final String dataset;
  private final String message;
  private final String mountPath;
  private final String error;

  public Optional<String> getMountPath() {
    return Optional.ofNullable(mountPath);
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }
}
