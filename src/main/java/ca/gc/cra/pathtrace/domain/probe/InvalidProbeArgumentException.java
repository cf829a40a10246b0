package ca.gc.cra.pathtrace.domain.probe;

/**
 * The probe tool rejected one of its arguments mid-output.
 *
 * @since 0.1.0
 */
public final class InvalidProbeArgumentException extends ProbeOutputException {
  private static final long serialVersionUID = 1L;

  public InvalidProbeArgumentException(String line) {
    super("probe tool rejected its arguments", line);
  }
}
