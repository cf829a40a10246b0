package ca.gc.cra.pathtrace.domain.probe;

import ca.gc.cra.pathtrace.validation.Net;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Token classification rules for one traceroute output format.
 * <p><strong>Why:</strong> Probe output carries no labels; whether a token is an address, a resolved name,
 * or a round-trip time depends on which traceroute implementation printed it.</p>
 * <p><strong>Role:</strong> Stateless domain value passed explicitly to the hop line parser.</p>
 * <p><strong>Rules:</strong>
 * <table>
 *   <caption>Token predicates per dialect</caption>
 *   <tr><th></th><th>{@link #MODERN}</th><th>{@link #INETUTILS}</th></tr>
 *   <tr><td>timeout</td><td>{@code *}</td><td>{@code *}</td></tr>
 *   <tr><td>address</td><td>{@code (192.0.2.1)}</td><td>{@code 192.0.2.1}</td></tr>
 *   <tr><td>time</td><td>{@code 11.2}</td><td>{@code 11.2ms}</td></tr>
 *   <tr><td>name</td><td>anything else except {@code ms}</td><td>{@code (router.example)}</td></tr>
 * </table>
 * Predicates are tried in the order timeout, address, time, name; tokens matching none are
 * {@link TokenKind#IGNORED}.
 * <p>One exception overrides the table: a token starting with {@code !} (ICMP annotations such as
 * {@code !H} or {@code !N}) is {@link TokenKind#IGNORED} in both dialects, before the address and name
 * predicates run. Under the {@link #MODERN} name rule alone it would be a hostname.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum Dialect {
  /** {@code traceroute} 2.x for Linux: addresses in parentheses, bare times followed by {@code ms}. */
  MODERN("Modern traceroute for Linux") {
    @Override
    boolean isAddress(String token) {
      return wrappedInParens(token) && Net.isIpv4Literal(interior(token));
    }

    @Override
    boolean isTime(String token) {
      return DECIMAL.matcher(token).matches();
    }

    @Override
    boolean isName(String token) {
      return !MS_UNIT.equals(token);
    }

    @Override
    String timeValue(String token) {
      return token;
    }
  },

  /** GNU inetutils {@code traceroute}: bare addresses, names in parentheses, {@code ms}-suffixed times. */
  INETUTILS("traceroute (GNU inetutils)") {
    @Override
    boolean isAddress(String token) {
      return Net.isIpv4Literal(token);
    }

    @Override
    boolean isTime(String token) {
      return token.endsWith(MS_UNIT)
          && DECIMAL.matcher(token.substring(0, token.length() - MS_UNIT.length())).matches();
    }

    @Override
    boolean isName(String token) {
      if (!wrappedInParens(token)) {
        return false;
      }
      String interior = interior(token);
      return !interior.isEmpty() && !Net.isIpv4Literal(interior);
    }

    @Override
    String timeValue(String token) {
      return token.substring(0, token.length() - MS_UNIT.length());
    }
  };

  /** Literal printed for a probe that received no reply. */
  public static final String TIMEOUT_MARKER = "*";

  private static final String MS_UNIT = "ms";
  private static final Pattern DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?|\\.\\d+");

  private final String versionBannerPrefix;

  Dialect(String versionBannerPrefix) {
    this.versionBannerPrefix = versionBannerPrefix;
  }

  /**
   * Classifies a single whitespace-delimited token.
   *
   * @param token raw token; must not be {@code null} or contain whitespace
   * @return classified token with its normalized value
   */
  public ProbeToken classify(String token) {
    if (TIMEOUT_MARKER.equals(token)) {
      return new ProbeToken(TokenKind.TIMEOUT, token);
    }
    if (token.startsWith("!")) {
      return new ProbeToken(TokenKind.IGNORED, token);
    }
    if (isAddress(token)) {
      return new ProbeToken(TokenKind.ADDRESS, stripParens(token));
    }
    if (isTime(token)) {
      return new ProbeToken(TokenKind.TIME, timeValue(token));
    }
    if (isName(token)) {
      return new ProbeToken(TokenKind.NAME, stripParens(token));
    }
    return new ProbeToken(TokenKind.IGNORED, token);
  }

  /**
   * Returns the product prefix printed on the first line of {@code traceroute --version}.
   *
   * @return version banner prefix
   */
  public String versionBannerPrefix() {
    return versionBannerPrefix;
  }

  /**
   * Resolves a dialect from the first line printed by {@code traceroute --version}.
   *
   * @param banner version banner, e.g. {@code Modern traceroute for Linux, version 2.1.0}
   * @return matching dialect
   * @throws UnknownDialectException when no dialect recognizes the banner
   */
  public static Dialect fromVersionBanner(String banner) {
    String trimmed = banner == null ? "" : banner.trim();
    for (Dialect dialect : values()) {
      if (trimmed.startsWith(dialect.versionBannerPrefix)) {
        return dialect;
      }
    }
    throw new UnknownDialectException("unsupported traceroute version: '" + trimmed + "'");
  }

  /**
   * Resolves a dialect from its configuration name (case-insensitive).
   *
   * @param name {@code modern} or {@code inetutils}
   * @return matching dialect
   * @throws UnknownDialectException when the name matches no dialect
   */
  public static Dialect fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new UnknownDialectException("dialect must be provided");
    }
    String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (Dialect dialect : values()) {
      if (dialect.name().equals(normalized)) {
        return dialect;
      }
    }
    throw new UnknownDialectException("unknown dialect: " + name.trim());
  }

  abstract boolean isAddress(String token);

  abstract boolean isTime(String token);

  abstract boolean isName(String token);

  abstract String timeValue(String token);

  private static boolean wrappedInParens(String token) {
    return token.length() >= 2 && token.charAt(0) == '(' && token.charAt(token.length() - 1) == ')';
  }

  private static String interior(String token) {
    return token.substring(1, token.length() - 1);
  }

  private static String stripParens(String token) {
    return wrappedInParens(token) ? interior(token) : token;
  }
}
