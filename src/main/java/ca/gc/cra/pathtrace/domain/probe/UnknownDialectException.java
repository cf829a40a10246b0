package ca.gc.cra.pathtrace.domain.probe;

/**
 * Raised at configuration time when a dialect name or {@code traceroute --version} banner matches no
 * supported output format.
 *
 * @since 0.1.0
 */
public final class UnknownDialectException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message description naming the rejected input
   */
  public UnknownDialectException(String message) {
    super(message);
  }
}
