package ca.gc.cra.pathtrace.validation;

import java.util.regex.Pattern;

/**
 * Network literal validation utilities for PATHTRACE.
 *
 * <p>Used both for probe targets supplied on the command line and for classifying address tokens in
 * probe output.</p>
 */
public final class Net {

  // RFC-conservative bounds
  private static final int MAX_HOSTNAME_LENGTH = 253;   // total length
  private static final int MAX_LABEL_LENGTH    = 63;    // per label

  // IPv4 dotted-quad shape (fast pre-check); we still range-check octets.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Returns whether {@code value} is a dotted-quad IPv4 literal with every octet in {@code [0,255]}.
   *
   * @param value candidate token; {@code null} yields {@code false}
   * @return {@code true} for literals such as {@code 192.0.2.1}
   */
  public static boolean isIpv4Literal(String value) {
    if (value == null || !IPV4_PATTERN.matcher(value).matches()) {
      return false;
    }
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? value.indexOf('.', startIndex) : value.length();
      final int octet = Integer.parseInt(value.substring(startIndex, endIndex));
      if (octet > 255) {
        return false;
      }
      startIndex = endIndex + 1;
    }
    return true;
  }

  /**
   * Validates a probe target: either an IPv4 literal or a DNS hostname.
   *
   * @param value candidate target; must not be {@code null}
   * @return trimmed target
   * @throws IllegalArgumentException when the value is neither a valid IPv4 literal nor hostname
   */
  public static String validateTarget(String value) {
    final String sanitized = Strings.requireNonBlank("target", value);
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      if (!isIpv4Literal(sanitized)) {
        throw new IllegalArgumentException("target IPv4 octets must be between 0 and 255 (was " + sanitized + ")");
      }
      return sanitized;
    }
    validateHostname(sanitized);
    return sanitized;
  }

  /** Deterministic hostname validator (ASCII/Punycode). */
  private static void validateHostname(String host) {
    final int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException("invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }

    int start = 0;
    while (true) {
      final int dot = host.indexOf('.', start);
      final int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break; // last label done
      }
      start = dot + 1;
      if (start == len) {
        // trailing dot marks a fully-qualified name
        break;
      }
    }
  }

  /**
   * Validates a single label [start,end):
   * - length 1..63
   * - first/last are alnum
   * - interior chars are alnum, '-' or '_'
   */
  private static void validateLabel(String s, int start, int end) {
    final int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException("invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }

    final char first = s.charAt(start);
    final char last  = s.charAt(end - 1);
    if (!isAsciiAlnum(first) || !isAsciiAlnum(last)) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }

    for (int i = start + 1; i < end - 1; i++) {
      final char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-' || c == '_')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  /** Fast ASCII alphanumeric check (no locale). */
  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
