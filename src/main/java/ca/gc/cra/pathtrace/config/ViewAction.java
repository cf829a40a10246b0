package ca.gc.cra.pathtrace.config;

import java.util.Locale;

/**
 * Report produced by the {@code view} command.
 *
 * @since 0.1.0
 */
public enum ViewAction {
  /** Store-wide run totals. */
  INFO,
  /** Run counts per target. */
  HOSTNAMES,
  /** Store-wide summary, or one summary per selected target. */
  STATS,
  /** Per-hop statistics table of each selected target. */
  TABLE,
  /** Graphviz DOT topology of the selected targets. */
  MAP;

  public static ViewAction fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("action must be provided");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (ViewAction action : values()) {
      if (action.name().equals(normalized)) {
        return action;
      }
    }
    throw new IllegalArgumentException(
        "action must be one of info, hostnames, stats, table, map (was " + raw.trim() + ")");
  }
}
