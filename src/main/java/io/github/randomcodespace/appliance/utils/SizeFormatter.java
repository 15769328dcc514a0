package io.github.randomcodespace.appliance.utils;

import java.util.Locale;

/** Formats raw byte counts reported by {@code zfs get -Hp}. */
public final class SizeFormatter {
  private static final String[] UNITS = {"B", "K", "M", "G", "T"};

  private SizeFormatter() {}

  /**
   * Converts a raw byte count to a binary (1024-based) unit with one decimal place, e.g. {@code
   * "10737418240"} becomes {@code "10.0G"}. The sentinels {@code none}, {@code 0} and {@code -} are
   * returned unchanged, an empty value becomes {@code "0"}, and anything non-numeric passes
   * through untouched.
   */
  public static String humanSize(String raw) {
    if (raw == null || raw.isEmpty()) {
      return "0";
    }
    if (raw.equals("none") || raw.equals("0") || raw.equals("-")) {
      return raw;
    }
    long bytes;
    try {
      bytes = Long.parseLong(raw.trim());
    } catch (NumberFormatException e) {
      return raw;
    }
    if (bytes < 1024) {
      return bytes + "B";
    }
    double size = bytes;
    for (String unit : UNITS) {
      if (size < 1024) {
        return String.format(Locale.ROOT, "%.1f%s", size, unit);
      }
      size /= 1024;
    }
    return String.format(Locale.ROOT, "%.1fP", size);
  }
}
