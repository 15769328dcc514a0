package io.github.randomcodespace.appliance.detection;

import io.github.randomcodespace.appliance.enums.HostTool;
import java.nio.file.Path;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@RequiredArgsConstructor
@ToString
public class DetectedToolInfo {
  private final HostTool toolType;
  private final Path executablePath;

  /** Relies on {@code PATH} lookup at execution time instead of an absolute path. */
  public static DetectedToolInfo onPath(HostTool toolType) {
    return new DetectedToolInfo(toolType, Path.of(toolType.getExecutableName()));
  }
}
