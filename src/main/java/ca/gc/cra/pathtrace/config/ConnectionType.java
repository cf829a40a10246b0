package ca.gc.cra.pathtrace.config;

import java.util.Locale;

/**
 * Probe packet type requested from the probe tool.
 *
 * @since 0.1.0
 */
public enum ConnectionType {
  UDP,
  ICMP;

  /**
   * Returns the lowercase name used on the probe tool's command line.
   *
   * @return {@code udp} or {@code icmp}
   */
  public String argument() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a connection type name.
   *
   * @param raw {@code udp} or {@code icmp}, case-insensitive
   * @return matching type
   * @throws IllegalArgumentException for any other value
   */
  public static ConnectionType fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("connectionType must be provided");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (ConnectionType type : values()) {
      if (type.name().equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("connectionType must be udp or icmp (was " + raw.trim() + ")");
  }
}
