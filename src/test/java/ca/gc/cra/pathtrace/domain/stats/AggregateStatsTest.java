package ca.gc.cra.pathtrace.domain.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class AggregateStatsTest {

  @Test
  void emptySamplesHaveNoValues() {
    AggregateStats stats = AggregateStats.of(List.of());
    assertTrue(stats.isEmpty());
    assertEquals(0, stats.count());
    assertFalse(stats.mean().isPresent());
    assertFalse(stats.stdev().isPresent());
  }

  @Test
  void singleSampleHasNoDeviation() {
    AggregateStats stats = AggregateStats.of(List.of(4.2));
    assertEquals(1, stats.count());
    assertEquals(4.2, stats.mean().getAsDouble(), 1e-9);
    assertEquals(4.2, stats.min().getAsDouble(), 1e-9);
    assertEquals(4.2, stats.max().getAsDouble(), 1e-9);
    assertFalse(stats.stdev().isPresent());
  }

  @Test
  void usesSampleStandardDeviation() {
    AggregateStats stats = AggregateStats.of(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0));
    assertEquals(8, stats.count());
    assertEquals(5.0, stats.mean().getAsDouble(), 1e-9);
    assertEquals(2.0, stats.min().getAsDouble(), 1e-9);
    assertEquals(9.0, stats.max().getAsDouble(), 1e-9);
    assertEquals(Math.sqrt(32.0 / 7.0), stats.stdev().getAsDouble(), 1e-9);
  }
}
