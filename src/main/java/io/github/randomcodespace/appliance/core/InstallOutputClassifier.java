package io.github.randomcodespace.appliance.core;

import io.github.randomcodespace.appliance.utils.ProcessExecutor.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides from the build tool's output how far a failed create got. The tool prints {@value
 * #DEFAULT_INSTALL_MARKER} to stdout once it starts installing; a pure evaluation or build failure
 * leaves stdout empty.
 */
public class InstallOutputClassifier {
  private static final Logger logger = LoggerFactory.getLogger(InstallOutputClassifier.class);

  public static final String DEFAULT_INSTALL_MARKER = "Installing containers:";

  private final String installMarker;

  public InstallOutputClassifier() {
    this(DEFAULT_INSTALL_MARKER);
  }

  public InstallOutputClassifier(String installMarker) {
    this.installMarker = installMarker;
  }

  public BuildOutcome classify(String name, ExecutionResult result) {
    String raw = result.errorDetail();
    if (result.succeeded()) {
      return new BuildOutcome(BuildOutcome.Kind.SUCCESS, result.stdout());
    }
    String stdout = result.stdout() == null ? "" : result.stdout();
    if (stdout.contains(installMarker)) {
      return new BuildOutcome(BuildOutcome.Kind.PARTIAL_INSTALL_FAILURE, raw);
    }
    if (stdout.isBlank()) {
      return new BuildOutcome(BuildOutcome.Kind.BUILD_FAILURE, raw);
    }
    logger.warn(
        "Build failure heuristic mismatch for '{}': stdout is non-empty but has no '{}' marker."
            + " Treating as build failure. stdout: {}",
        name,
        installMarker,
        stdout.length() > 200 ? stdout.substring(0, 200) + "..." : stdout);
    return new BuildOutcome(BuildOutcome.Kind.UNKNOWN_FAILURE, raw);
  }
}
