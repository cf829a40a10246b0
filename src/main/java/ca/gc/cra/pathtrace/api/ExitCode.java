package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.domain.probe.ProbeOutputException;
import java.io.IOException;

/**
 * Process status returned by {@code trace}, {@code ingest} and {@code view}.
 *
 * <p>Only {@link #SUCCESS} means a run was appended (or a report written). {@link #PROBE_FAILURE} separates
 * a target that could not be measured from a broken local setup ({@link #IO_ERROR},
 * {@link #CONFIG_ERROR}), so scheduled probes can retry the former and alert on the latter.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  SUCCESS(0),
  /** Bad option, unknown switch or missing required option; usage was printed. */
  INVALID_ARGS(2),
  /** History file, captured output or YAML file could not be read or written. */
  IO_ERROR(3),
  /** Options passed parsing but were rejected once the command ran, e.g. an unsupported traceroute. */
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  /** traceroute failed, or printed output that could not be turned into a run. */
  PROBE_FAILURE(6),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Maps a failure raised while a command runs, after its options were accepted.
   *
   * @param failure exception that ended the command
   * @return matching status; never {@link #SUCCESS} or {@link #INVALID_ARGS}
   */
  static ExitCode forFailure(Throwable failure) {
    if (failure instanceof ProbeOutputException) {
      return PROBE_FAILURE;
    }
    if (failure instanceof IOException) {
      return IO_ERROR;
    }
    if (failure instanceof InterruptedException) {
      return INTERRUPTED;
    }
    if (failure instanceof IllegalArgumentException) {
      return CONFIG_ERROR;
    }
    return RUNTIME_FAILURE;
  }
}
