package io.github.randomcodespace.appliance.builder;

import io.github.randomcodespace.appliance.exceptions.ContainerSpecValidationException;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Container name rules shared by every operation that accepts a name. Names become nspawn machine
 * names and, prefixed with {@code ve-}, host network interface names, which Linux caps at 15
 * characters; NixOS enforces 11 for the name part.
 */
public final class ContainerNames {
  public static final int MAX_LENGTH = 11;

  private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9](-?[a-z0-9])*$");

  private ContainerNames() {}

  /** Returns an error message when the name is invalid, or empty when it is acceptable. */
  public static Optional<String> validate(String name) {
    if (name == null || name.isEmpty()) {
      return Optional.of("Container name must not be empty.");
    }
    if (!NAME_PATTERN.matcher(name).matches()) {
      return Optional.of(
          "Container name '"
              + name
              + "' is invalid. Must be lowercase alphanumeric with single hyphens, "
              + "no leading/trailing hyphens (e.g. 'my-dev').");
    }
    if (name.length() > MAX_LENGTH) {
      return Optional.of(
          "Container name '"
              + name
              + "' is too long ("
              + name.length()
              + " chars). Must be "
              + MAX_LENGTH
              + " characters or fewer.");
    }
    return Optional.empty();
  }

  public static String requireValid(String name) {
    Optional<String> error = validate(name);
    if (error.isPresent()) {
      throw new ContainerSpecValidationException(error.get());
    }
    return name;
  }
}
