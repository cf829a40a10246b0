package ca.gc.cra.pathtrace.config;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import java.util.Optional;

/**
 * Dialect selection for live probes: a fixed dialect, or detection from {@code traceroute --version}.
 *
 * @since 0.1.0
 */
public enum DialectChoice {
  AUTO(null),
  MODERN(Dialect.MODERN),
  INETUTILS(Dialect.INETUTILS);

  private final Dialect dialect;

  DialectChoice(Dialect dialect) {
    this.dialect = dialect;
  }

  /**
   * Returns the fixed dialect.
   *
   * @return dialect, or empty for {@link #AUTO}
   */
  public Optional<Dialect> fixed() {
    return Optional.ofNullable(dialect);
  }

  /**
   * Parses {@code auto}, {@code modern} or {@code inetutils}.
   *
   * @param raw configured value; blank means {@link #AUTO}
   * @return parsed choice
   * @throws ca.gc.cra.pathtrace.domain.probe.UnknownDialectException for any other value
   */
  public static DialectChoice fromString(String raw) {
    if (raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("auto")) {
      return AUTO;
    }
    return valueOf(Dialect.fromName(raw).name());
  }
}
