package ca.gc.cra.pathtrace.infrastructure.time;

import ca.gc.cra.pathtrace.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock} and {@link System#nanoTime()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates a system clock adapter using the UTC system clock.
   */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Instant now() {
    return clock.instant();
  }

  /**
   * Returns {@link System#nanoTime()}.
   *
   * @return monotonic nanoseconds
   */
  @Override
  public long monotonicNanos() {
    return System.nanoTime();
  }
}
