package ca.gc.cra.pathtrace.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps and a monotonic tick source to run assembly.
 * <p><strong>Why:</strong> Run timestamps and durations must be deterministic under test.</p>
 * <p><strong>Role:</strong> Domain port consumed by {@code RunAssembler}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.pathtrace.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current wall-clock instant used to stamp a run.
   *
   * @return current instant
   */
  Instant now();

  /**
   * Returns a monotonic tick in nanoseconds for measuring elapsed time.
   *
   * @return nanoseconds from an arbitrary origin; only differences are meaningful
   */
  long monotonicNanos();
}
