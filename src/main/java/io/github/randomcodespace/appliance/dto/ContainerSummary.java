package io.github.randomcodespace.appliance.dto;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/** A running or stopped machine known to the host. */
@Getter
@Builder
@ToString
public class ContainerSummary {
  public static final String STATE_RUNNING = "running";
  public static final String STATE_STOPPED = "stopped";
  public static final String CLASS_CONTAINER = "container";

  private final String name;
  private final String machineClass; // "container" or "vm"
  private final String service; // e.g. "nspawn", "libvirt"
  private final String state; // e.g. "running", "stopped", "degraded"

  @Singular private final List<String> addresses;

  public boolean isRunning() {
    return STATE_RUNNING.equals(state);
  }

  public boolean isContainer() {
    return CLASS_CONTAINER.equals(machineClass);
  }
}
