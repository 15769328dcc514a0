package io.github.randomcodespace.appliance.ownership;

import io.github.randomcodespace.appliance.builder.ContainerNames;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the owner from the container's built system closure, so it also works for stopped
 * containers. {@code <confDir>/<name>.conf} names the closure through {@code SYSTEM_PATH=...};
 * the closure's {@code etc/set-environment} exports the owner variable.
 */
public class SystemClosureOwnerDiscovery implements OwnerDiscovery {
  private static final Logger logger = LoggerFactory.getLogger(SystemClosureOwnerDiscovery.class);

  private static final Pattern SYSTEM_PATH =
      Pattern.compile("^SYSTEM_PATH=(.+)$", Pattern.MULTILINE);

  private final Path confDirectory;
  private final Pattern exportPattern;

  public SystemClosureOwnerDiscovery(Path confDirectory, String ownerVariable) {
    this.confDirectory = confDirectory;
    this.exportPattern =
        Pattern.compile(
            "^export\\s+" + Pattern.quote(ownerVariable) + "=\"([^\"]*)\"", Pattern.MULTILINE);
  }

  @Override
  public String name() {
    return "system-closure";
  }

  @Override
  public CompletableFuture<Optional<String>> discover(String containerName) {
    return CompletableFuture.supplyAsync(() -> readOwner(containerName));
  }

  Optional<String> readOwner(String containerName) {
    if (ContainerNames.validate(containerName).isPresent()) {
      logger.debug("Not reading closure for invalid container name '{}'", containerName);
      return Optional.empty();
    }
    Path conf = confDirectory.resolve(containerName + ".conf");
    Optional<String> systemPath = read(conf).flatMap(text -> firstGroup(SYSTEM_PATH, text));
    if (systemPath.isEmpty()) {
      logger.debug("No SYSTEM_PATH for '{}' in {}", containerName, conf);
      return Optional.empty();
    }
    Path environment = Path.of(systemPath.get().trim(), "etc", "set-environment");
    return read(environment)
        .flatMap(text -> firstGroup(exportPattern, text))
        .filter(owner -> !owner.isEmpty());
  }

  private static Optional<String> firstGroup(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
  }

  private static Optional<String> read(Path file) {
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      logger.debug("Could not read {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }
}
