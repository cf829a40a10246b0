package ca.gc.cra.pathtrace.domain.probe;

import java.util.Objects;

/**
 * A classified probe output token.
 *
 * @param kind category assigned by the dialect
 * @param value normalized payload: parentheses and {@code ms} suffixes stripped; the raw token for
 *     {@link TokenKind#TIMEOUT} and {@link TokenKind#IGNORED}
 * @since 0.1.0
 */
public record ProbeToken(TokenKind kind, String value) {

  public ProbeToken {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(value, "value");
  }

  /**
   * Returns the round-trip time carried by a {@link TokenKind#TIME} token.
   *
   * @return milliseconds
   * @throws IllegalStateException if this token is not a time token
   */
  public double millis() {
    if (kind != TokenKind.TIME) {
      throw new IllegalStateException("token " + value + " is " + kind + ", not TIME");
    }
    return Double.parseDouble(value);
  }
}
