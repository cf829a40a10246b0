package ca.gc.cra.pathtrace.logging;

import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Formats raw traceroute output for log messages.
 * <p><strong>Why:</strong> traceroute pads its columns with runs of spaces and a misbehaving tool can print
 * arbitrarily long lines; logged lines are collapsed and capped so DEBUG output stays one short line per hop.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** UTF-8 budget for one logged probe line. */
  public static final int PROBE_LINE_BYTES = 256;

  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private Logs() {}

  /**
   * Collapses whitespace runs of a probe line and caps it at {@link #PROBE_LINE_BYTES}.
   *
   * @param line raw line; {@code null} is rendered as {@code <null>}
   * @return loggable form of the line
   */
  public static String probeLine(String line) {
    if (line == null) {
      return "<null>";
    }
    return truncate(WHITESPACE_RUN.matcher(line.strip()).replaceAll(" "), PROBE_LINE_BYTES);
  }

  /**
   * Cuts a value to at most {@code maxBytes} UTF-8 bytes without splitting a code point.
   *
   * @param value text to cut; must not be {@code null}
   * @param maxBytes byte budget; must be positive
   * @return the value itself when it fits, otherwise the kept prefix followed by
   *     {@code "... (truncated, kept of total bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int kept = 0;
    int end = 0;
    int total = 0;
    for (int i = 0; i < value.length(); ) {
      int codePoint = value.codePointAt(i);
      int size = utf8Length(codePoint);
      total += size;
      i += Character.charCount(codePoint);
      if (total <= maxBytes) {
        kept = total;
        end = i;
      }
    }
    if (total <= maxBytes) {
      return value;
    }
    return value.substring(0, end) + "... (truncated, " + kept + " of " + total + " bytes)";
  }

  private static int utf8Length(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
