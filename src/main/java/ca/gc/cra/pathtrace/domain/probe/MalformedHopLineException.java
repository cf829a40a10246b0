package ca.gc.cra.pathtrace.domain.probe;

/**
 * A hop line has no leading hop index, or its index does not follow the previous hop.
 *
 * @since 0.1.0
 */
public final class MalformedHopLineException extends ProbeOutputException {
  private static final long serialVersionUID = 1L;

  public MalformedHopLineException(String message, String line) {
    super(message, line);
  }
}
