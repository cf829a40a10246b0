package ca.gc.cra.pathtrace.domain.probe;

import java.util.Optional;

/**
 * <strong>What:</strong> Base type for probe output that cannot be turned into a run.
 * <p><strong>Why:</strong> Each subtype aborts the current run only; callers keep every run recorded
 * before it and decide whether to retry, skip, or exit.</p>
 * <p><strong>Thread-safety:</strong> Immutable once thrown.</p>
 *
 * @since 0.1.0
 */
public abstract class ProbeOutputException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String line;

  /**
   * Creates the exception.
   *
   * @param message failure description
   * @param line offending raw line; may be {@code null} when no single line is at fault
   */
  protected ProbeOutputException(String message, String line) {
    super(message);
    this.line = line;
  }

  /**
   * Returns the raw probe output line that triggered the failure.
   *
   * @return offending line when known
   */
  public Optional<String> line() {
    return Optional.ofNullable(line);
  }
}
