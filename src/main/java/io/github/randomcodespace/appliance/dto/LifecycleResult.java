package io.github.randomcodespace.appliance.dto;

import io.github.randomcodespace.appliance.enums.FailureKind;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Outcome of a create, start, stop or destroy call. */
@Getter
@Builder
@ToString
public class LifecycleResult {
  private final boolean success;
  private final String name;
  private final String message;
  private final String error; // raw tool output on failure
  private final FailureKind failureKind;

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }

  public Optional<FailureKind> getFailureKind() {
    return Optional.ofNullable(failureKind);
  }

  public static LifecycleResult succeeded(String name, String message) {
    return LifecycleResult.builder().success(true).name(name).message(message).build();
  }

  public static LifecycleResult failed(
      String name, FailureKind kind, String message, String error) {
    return LifecycleResult.builder()
        .success(false)
        .name(name)
        .failureKind(kind)
        .message(message)
        .error(error)
        .build();
  }
}
