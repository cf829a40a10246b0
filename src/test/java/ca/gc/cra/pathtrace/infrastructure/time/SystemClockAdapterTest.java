package ca.gc.cra.pathtrace.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SystemClockAdapterTest {

  @Test
  void nowComesFromTheClock() {
    Instant fixed = Instant.parse("2024-03-01T10:15:30Z");

    assertEquals(fixed, new SystemClockAdapter(Clock.fixed(fixed, ZoneOffset.UTC)).now());
  }

  @Test
  void monotonicNanosNeverGoBackwards() {
    SystemClockAdapter clock = new SystemClockAdapter();
    long first = clock.monotonicNanos();

    assertTrue(clock.monotonicNanos() >= first);
  }
}
