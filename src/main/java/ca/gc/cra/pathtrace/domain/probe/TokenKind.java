package ca.gc.cra.pathtrace.domain.probe;

/**
 * Disjoint categories a probe output token can fall into.
 *
 * @since 0.1.0
 * @see Dialect#classify(String)
 */
public enum TokenKind {
  /** Probe answered with nothing ({@code *}). */
  TIMEOUT,
  /** IPv4 address literal of the responding interface. */
  ADDRESS,
  /** Round-trip time in milliseconds. */
  TIME,
  /** Name resolved by the probe tool itself. */
  NAME,
  /** Token that carries no information for the hop, such as a standalone {@code ms} unit. */
  IGNORED
}
