package ca.gc.cra.pathtrace.domain.probe;

/**
 * The probe tool could not resolve the target name; reported on its banner line before any hop.
 *
 * @since 0.1.0
 */
public final class UnresolvedHostException extends ProbeOutputException {
  private static final long serialVersionUID = 1L;

  public UnresolvedHostException(String target, String line) {
    super("unable to resolve target " + target, line);
  }
}
