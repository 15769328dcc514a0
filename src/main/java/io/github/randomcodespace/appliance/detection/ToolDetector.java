package io.github.randomcodespace.appliance.detection;

import io.github.randomcodespace.appliance.enums.HostTool;
import io.github.randomcodespace.appliance.exceptions.ToolNotFoundException;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the host tools on the search path. NixOS keeps most binaries outside the FHS locations,
 * so the system profile and setuid wrapper directories are searched after {@code PATH}.
 */
public class ToolDetector {
  private static final Logger logger = LoggerFactory.getLogger(ToolDetector.class);

  static final List<String> NIXOS_COMMON_PATHS =
      Arrays.asList(
          "/run/current-system/sw/bin",
          "/run/wrappers/bin",
          "/nix/var/nix/profiles/default/bin",
          "/usr/bin",
          "/usr/local/bin");

  private final List<Path> searchPath;

  public ToolDetector() {
    this(defaultSearchPath(System.getenv("PATH")));
  }

  public ToolDetector(List<Path> searchPath) {
    this.searchPath = List.copyOf(searchPath);
  }

  static List<Path> defaultSearchPath(String systemPath) {
    List<Path> dirs = new ArrayList<>();
    if (systemPath != null && !systemPath.isBlank()) {
      for (String dir : systemPath.split(File.pathSeparator)) {
        if (!dir.isBlank()) {
          dirs.add(Path.of(dir));
        }
      }
    }
    for (String common : NIXOS_COMMON_PATHS) {
      Path dir = Path.of(common);
      if (!dirs.contains(dir)) {
        dirs.add(dir);
      }
    }
    return dirs;
  }

  public CompletableFuture<Optional<DetectedToolInfo>> detectTool(HostTool toolType) {
    return CompletableFuture.supplyAsync(
        () -> {
          Optional<DetectedToolInfo> info =
              findExecutable(toolType.getExecutableName())
                  .map(path -> new DetectedToolInfo(toolType, path));
          if (info.isPresent()) {
            logger.debug("Found {} executable at: {}", toolType, info.get().getExecutablePath());
          } else {
            logger.debug("Executable for {} not found.", toolType);
          }
          return info;
        });
  }

  /**
   * Detects every requested tool.
   *
   * @throws ToolNotFoundException (through the future) naming every tool that is missing.
   */
  public CompletableFuture<Map<HostTool, DetectedToolInfo>> detectAll(List<HostTool> tools) {
    List<CompletableFuture<Optional<DetectedToolInfo>>> detections = new ArrayList<>();
    for (HostTool tool : tools) {
      detections.add(detectTool(tool));
    }
    return CompletableFuture.allOf(detections.toArray(new CompletableFuture[0]))
        .thenApply(
            v -> {
              Map<HostTool, DetectedToolInfo> found = new EnumMap<>(HostTool.class);
              List<String> missing = new ArrayList<>();
              for (int i = 0; i < tools.size(); i++) {
                Optional<DetectedToolInfo> info = detections.get(i).join();
                if (info.isPresent()) {
                  found.put(tools.get(i), info.get());
                } else {
                  missing.add(tools.get(i).getExecutableName());
                }
              }
              if (!missing.isEmpty()) {
                throw new ToolNotFoundException(
                    "Required host tools not found: "
                        + String.join(", ", missing)
                        + " (searched "
                        + searchPath
                        + ")");
              }
              logger.info("Detected host tools: {}", found.values());
              return found;
            });
  }

  private Optional<Path> findExecutable(String executableName) {
    return searchPath.stream()
        .map(dir -> dir.resolve(executableName))
        .filter(path -> Files.isRegularFile(path) && Files.isExecutable(path))
        .findFirst();
  }
}
