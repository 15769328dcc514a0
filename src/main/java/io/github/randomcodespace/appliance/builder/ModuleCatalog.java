package io.github.randomcodespace.appliance.builder;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.randomcodespace.appliance.exceptions.ModuleDiscoveryException;
import io.github.randomcodespace.appliance.tools.NixCli;
import io.github.randomcodespace.appliance.utils.JsonParserUtil;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Module names the flake exports under {@code lib.availableModules}. The first successful
 * evaluation is cached for the lifetime of the catalog; call {@link #invalidate()} after the flake
 * changes.
 */
public class ModuleCatalog {
  private static final Logger logger = LoggerFactory.getLogger(ModuleCatalog.class);

  static final String ATTRIBUTE = ".#lib.availableModules";

  private final NixCli nix;
  private final Path flakePath;
  private final Duration timeout;
  private final AtomicReference<CompletableFuture<List<String>>> cached = new AtomicReference<>();

  public ModuleCatalog(NixCli nix, Path flakePath, Duration timeout) {
    this.nix = nix;
    this.flakePath = flakePath;
    this.timeout = timeout;
  }

  /**
   * Sorted module names. A failed discovery is not cached.
   *
   * @return Fails with {@link ModuleDiscoveryException} when the output is not a list of strings,
   *     or with the underlying command exception when evaluation fails.
   */
  public CompletableFuture<List<String>> availableModules() {
    CompletableFuture<List<String>> current = cached.get();
    if (current != null) {
      return current;
    }
    CompletableFuture<List<String>> discovery = discover();
    if (!cached.compareAndSet(null, discovery)) {
      return cached.get();
    }
    discovery.whenComplete(
        (modules, ex) -> {
          if (ex != null) {
            cached.compareAndSet(discovery, null);
          }
        });
    return discovery;
  }

  /** Drops the cache and evaluates again. */
  public CompletableFuture<List<String>> refresh() {
    invalidate();
    return availableModules();
  }

  public void invalidate() {
    cached.set(null);
  }

  private CompletableFuture<List<String>> discover() {
    logger.debug("Discovering modules from {} in {}", ATTRIBUTE, flakePath);
    return nix.evalJson(ATTRIBUTE, flakePath, timeout).thenApply(ModuleCatalog::parseModules);
  }

  static List<String> parseModules(String json) {
    List<Object> raw =
        JsonParserUtil.fromJson(json, new TypeReference<List<Object>>() {})
            .orElseThrow(
                () ->
                    new ModuleDiscoveryException("Expected a JSON list of module names: " + json));
    if (!raw.stream().allMatch(item -> item instanceof String)) {
      throw new ModuleDiscoveryException("Module list contains non-string entries: " + raw);
    }
    List<String> modules =
        raw.stream()
            .map(Objects::toString)
            .sorted()
            .collect(Collectors.toUnmodifiableList());
    logger.info("Discovered {} modules: {}", modules.size(), modules);
    return modules;
  }
}
