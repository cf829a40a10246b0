package ca.gc.cra.pathtrace.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by PATHTRACE configuration and CLI layers.
 * <p><strong>Why:</strong> Ensures probe targets, gateway lists, and free-form command text are sanitized
 * before they reach the probe process or the history file.</p>
 * <p><strong>Role:</strong> Support utilities invoked before adapters allocate external resources.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Split comma-separated option values into trimmed, non-blank entries.</li>
 *   <li>Verify printable ASCII constraints for values forwarded to telemetry exporters.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Splits a comma-separated value into trimmed entries, dropping empty segments.
   *
   * @param name logical parameter name for diagnostics
   * @param value raw list such as {@code "a, b,c"}; {@code null} or blank yields an empty list
   * @return immutable list of sanitized entries in input order
   * @throws IllegalArgumentException if any entry contains control characters
   */
  public static List<String> splitList(String name, String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    List<String> entries = new ArrayList<>();
    for (String token : value.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      entries.add(requireNonBlank(name, token));
    }
    return List.copyOf(entries);
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value exceeds {@code maxLength} or contains non-printable
   *         ASCII characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
