package io.github.randomcodespace.appliance.core;

/** Classification of a non-zero exit from the build/install tool. */
public record BuildOutcome(Kind kind, String rawOutput) {

  public enum Kind {
    SUCCESS,
    /** Evaluation or build failed before anything was installed. */
    BUILD_FAILURE,
    /** Installation started, so the container may exist and its storage must be kept. */
    PARTIAL_INSTALL_FAILURE,
    /** Output did not match any known shape. */
    UNKNOWN_FAILURE
  }

  /** Only pure build failures, and failures that cannot be classified, roll storage back. */
  public boolean requiresStorageRollback() {
    return kind == Kind.BUILD_FAILURE || kind == Kind.UNKNOWN_FAILURE;
  }
}
