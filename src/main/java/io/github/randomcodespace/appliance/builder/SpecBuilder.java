package io.github.randomcodespace.appliance.builder;

import io.github.randomcodespace.appliance.dto.ContainerSpec;
import java.nio.file.Path;

/**
 * Translates a validated container request into the declarative expression consumed by the build
 * tool. Implementations must be pure: same input, same text, no side effects.
 */
@FunctionalInterface
public interface SpecBuilder {

  /**
   * @param spec The request, with its workspace path already filled in when storage was
   *     provisioned.
   * @param flakePath Root of the container definitions.
   * @return The expression text.
   */
  String build(ContainerSpec spec, Path flakePath);
}
