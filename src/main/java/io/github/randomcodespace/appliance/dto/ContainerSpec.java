package io.github.randomcodespace.appliance.dto;

import io.github.randomcodespace.appliance.builder.ContainerNames;
import io.github.randomcodespace.appliance.exceptions.ContainerSpecValidationException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Immutable request for one container. Building an instance validates it, so a {@code
 * ContainerSpec} that exists is always well formed.
 */
@Getter
@ToString
public class ContainerSpec {
  private final String name;
  private final String owner;
  private final List<String> modules;
  private final String workspacePath; // host path bind-mounted at /workspace
  @ToString.Exclude private final String enrollmentToken;

  @Builder(toBuilder = true)
  private ContainerSpec(
      String name,
      String owner,
      @Singular List<String> modules,
      String workspacePath,
      String enrollmentToken) {
    ContainerNames.requireValid(name);
    if (owner == null || owner.isBlank()) {
      throw new ContainerSpecValidationException("Owner must not be empty");
    }
    if (modules == null || modules.isEmpty()) {
      throw new ContainerSpecValidationException("At least one module must be specified");
    }
    Set<String> seen = new LinkedHashSet<>();
    Set<String> duplicates =
        modules.stream()
            .filter(module -> !seen.add(module))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    if (!duplicates.isEmpty()) {
      throw new ContainerSpecValidationException(
          "Duplicate modules: " + String.join(", ", duplicates));
    }
    this.name = name;
    this.owner = owner;
    this.modules = List.copyOf(modules);
    this.workspacePath = workspacePath;
    this.enrollmentToken = enrollmentToken;
  }

  public Optional<String> getWorkspacePath() {
    return Optional.ofNullable(workspacePath);
  }

  public Optional<String> getEnrollmentToken() {
    return Optional.ofNullable(enrollmentToken).filter(token -> !token.isBlank());
  }

  public boolean requestsModule(String module) {
    return modules.contains(module);
  }

  public ContainerSpec withWorkspacePath(String path) {
    return toBuilder().workspacePath(path).build();
  }

  public ContainerSpec withEnrollmentToken(String token) {
    return toBuilder().enrollmentToken(token).build();
  }
}
