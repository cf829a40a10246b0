package ca.gc.cra.pathtrace.domain.probe;

/**
 * A hop line reports fewer or more probe outcomes (times plus timeouts) than probes were sent.
 *
 * @since 0.1.0
 */
public final class ProbeCountMismatchException extends ProbeOutputException {
  private static final long serialVersionUID = 1L;

  private final int expected;
  private final int observed;

  /**
   * Creates the exception.
   *
   * @param line offending hop line
   * @param expected probes sent per hop
   * @param observed outcome tokens found on the line
   */
  public ProbeCountMismatchException(String line, int expected, int observed) {
    super("expected " + expected + " probe outcomes but found " + observed, line);
    this.expected = expected;
    this.observed = observed;
  }

  public int expected() {
    return expected;
  }

  public int observed() {
    return observed;
  }
}
