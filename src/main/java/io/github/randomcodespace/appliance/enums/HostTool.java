package io.github.randomcodespace.appliance.enums;

public enum HostTool {
  ZFS("zfs"),
  EXTRA_CONTAINER("extra-container"),
  NIXOS_CONTAINER("nixos-container"),
  MACHINECTL("machinectl"),
  NIX("nix");

  private final String executableName;

  HostTool(String executableName) {
    this.executableName = executableName;
  }

  public String getExecutableName() {
    return executableName;
  }
}
