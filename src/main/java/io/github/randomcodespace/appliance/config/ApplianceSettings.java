package io.github.randomcodespace.appliance.config;

import io.github.randomcodespace.appliance.exceptions.ConfigurationException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Process-wide configuration, built once at start-up and handed to the provisioner, resolver and
 * orchestrator constructors. Use {@link #fromEnvironment(Map)} in production and the builder in
 * tests.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ApplianceSettings {
  public static final String FLAKE_PATH_ENV = "APPLIANCE_FLAKE_PATH";
  public static final String DATASET_ROOT_ENV = "ZFS_DATASET_ROOT";
  public static final String USER_QUOTA_ENV = "ZFS_USER_QUOTA";
  public static final String ENROLLMENT_TOKEN_ENV = "TAILSCALE_AUTH_KEY";
  public static final String OWNER_VARIABLE_ENV = "APPLIANCE_OWNER_VARIABLE";
  public static final String CONF_DIR_ENV = "NIXOS_CONTAINERS_CONF_DIR";
  public static final String EXPRESSION_DIR_ENV = "APPLIANCE_EXPRESSION_DIR";
  public static final String BUILD_TIMEOUT_ENV = "APPLIANCE_BUILD_TIMEOUT_SECONDS";

  /** Root of the flake holding {@code nix/mkContainer.nix}. */
  @NonNull private final Path flakePath;

  /** Parent dataset of every owner's root; its mount path is {@code "/" + datasetRoot}. */
  @Builder.Default private final String datasetRoot = "tank";

  /** ZFS size string applied to each owner's root dataset, e.g. {@code 10G} or {@code none}. */
  @Builder.Default private final String userQuota = "10G";

  /** Reusable key injected into containers that request the enrollment module. */
  @ToString.Exclude private final String enrollmentToken;

  /** Environment variable baked into each container that names its owner. */
  @Builder.Default private final String ownerVariable = "APPLIANCE_OWNER";

  @Builder.Default private final Path containerConfDirectory = Path.of("/etc/nixos-containers");

  /** Where generated expressions are written before being handed to the build tool. */
  @Builder.Default
  private final Path expressionDirectory = Path.of(System.getProperty("java.io.tmpdir"));

  @Builder.Default private final Duration buildTimeout = Duration.ofSeconds(300);
  @Builder.Default private final Duration lifecycleTimeout = Duration.ofSeconds(60);
  @Builder.Default private final Duration destroyTimeout = Duration.ofSeconds(120);
  @Builder.Default private final Duration logoutTimeout = Duration.ofSeconds(15);
  @Builder.Default private final Duration ownerQueryTimeout = Duration.ofSeconds(10);
  @Builder.Default private final Duration inventoryTimeout = Duration.ofSeconds(15);
  @Builder.Default private final Duration zfsQueryTimeout = Duration.ofSeconds(10);
  @Builder.Default private final Duration zfsMutationTimeout = Duration.ofSeconds(30);
  @Builder.Default private final Duration moduleDiscoveryTimeout = Duration.ofSeconds(120);

  public Optional<String> getEnrollmentToken() {
    return Optional.ofNullable(enrollmentToken).filter(token -> !token.isBlank());
  }

  /**
   * Reads settings from environment variables. Only {@value #FLAKE_PATH_ENV} is required.
   *
   * @param env Usually {@code System.getenv()}.
   * @throws ConfigurationException if a required variable is missing or a value is malformed.
   */
  public static ApplianceSettings fromEnvironment(Map<String, String> env) {
    String flakePath = env.get(FLAKE_PATH_ENV);
    if (flakePath == null || flakePath.isBlank()) {
      throw new ConfigurationException(
          FLAKE_PATH_ENV
              + " is not set. It must point at the flake root holding nix/mkContainer.nix.");
    }
    ApplianceSettingsBuilder builder = ApplianceSettings.builder().flakePath(Path.of(flakePath));

    String datasetRoot = env.get(DATASET_ROOT_ENV);
    if (datasetRoot != null && !datasetRoot.isBlank()) {
      String trimmed = datasetRoot.trim();
      if (trimmed.startsWith("/") || trimmed.endsWith("/")) {
        throw new ConfigurationException(
            DATASET_ROOT_ENV + " must be a dataset name such as 'tank' or 'tank/users', got '"
                + datasetRoot + "'");
      }
      builder.datasetRoot(trimmed);
    }
    String quota = env.get(USER_QUOTA_ENV);
    if (quota != null && !quota.isBlank()) {
      builder.userQuota(quota.trim());
    }
    builder.enrollmentToken(env.get(ENROLLMENT_TOKEN_ENV));
    String ownerVariable = env.get(OWNER_VARIABLE_ENV);
    if (ownerVariable != null && !ownerVariable.isBlank()) {
      if (!ownerVariable.matches("[A-Za-z_][A-Za-z0-9_]*")) {
        throw new ConfigurationException(
            OWNER_VARIABLE_ENV + " is not a valid variable name: '" + ownerVariable + "'");
      }
      builder.ownerVariable(ownerVariable);
    }
    String confDir = env.get(CONF_DIR_ENV);
    if (confDir != null && !confDir.isBlank()) {
      builder.containerConfDirectory(Path.of(confDir));
    }
    String expressionDir = env.get(EXPRESSION_DIR_ENV);
    if (expressionDir != null && !expressionDir.isBlank()) {
      builder.expressionDirectory(Path.of(expressionDir));
    }
    String buildTimeout = env.get(BUILD_TIMEOUT_ENV);
    if (buildTimeout != null && !buildTimeout.isBlank()) {
      builder.buildTimeout(Duration.ofSeconds(parsePositiveSeconds(buildTimeout)));
    }
    return builder.build();
  }

  private static long parsePositiveSeconds(String raw) {
    try {
      long seconds = Long.parseLong(raw.trim());
      if (seconds <= 0) {
        throw new ConfigurationException(BUILD_TIMEOUT_ENV + " must be positive, got " + raw);
      }
      return seconds;
    } catch (NumberFormatException e) {
      throw new ConfigurationException(BUILD_TIMEOUT_ENV + " is not a number: '" + raw + "'", e);
    }
  }
}
