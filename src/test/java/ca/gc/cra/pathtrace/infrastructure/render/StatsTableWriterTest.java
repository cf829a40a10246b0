package ca.gc.cra.pathtrace.infrastructure.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pathtrace.domain.history.TargetInventory;
import ca.gc.cra.pathtrace.domain.stats.AggregateStats;
import ca.gc.cra.pathtrace.domain.stats.HopHost;
import ca.gc.cra.pathtrace.domain.stats.HopStats;
import ca.gc.cra.pathtrace.domain.stats.OverallSummary;
import ca.gc.cra.pathtrace.domain.stats.TargetStats;
import ca.gc.cra.pathtrace.domain.stats.TargetSummary;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class StatsTableWriterTest {
  private final StringWriter buffer = new StringWriter();
  private final StatsTableWriter writer = new StatsTableWriter(new PrintWriter(buffer));

  @Test
  void infoOmitsEmptyRunLineWhenAllRunsHaveData() {
    writer.writeInfo(List.of(new TargetInventory("a.example", 2, 0)));

    assertEquals(List.of("Targets               : 1", "Runs                  : 2"), lines());
  }

  @Test
  void infoCountsRunsWithoutData() {
    writer.writeInfo(List.of(new TargetInventory("a.example", 2, 1), new TargetInventory("b.example", 1, 0)));

    List<String> lines = lines();
    assertEquals("Runs                  : 4", lines.get(1));
    assertEquals("Runs without data     : 1", lines.get(2));
  }

  @Test
  void inventoryIsAlignedTable() {
    writer.writeInventory(List.of(new TargetInventory("example.org", 3, 1)));

    assertEquals(List.of(
        "Target      | Runs | With data | No data",
        "------------+------+-----------+--------",
        "example.org | 4    | 3         | 1"), lines());
  }

  @Test
  void targetTableListsEveryHostOfAHop() {
    AggregateStats firstHop = AggregateStats.of(List.of(1.0, 2.0, 3.0));
    TargetStats stats = new TargetStats("example.org", 1, 0, List.of(
        new HopStats(1, List.of(
            new HopHost("192.0.2.1", Optional.of("gw")),
            new HopHost("192.0.2.2", Optional.empty())), firstHop),
        new HopStats(2, List.of(new HopHost(HopHost.UNKNOWN_ADDRESS, Optional.empty())), AggregateStats.empty())),
        firstHop);

    writer.writeTargetStats(stats);

    List<String> lines = lines();
    assertEquals("Target: example.org (runs with data: 1, without data: 0)", lines.get(0));
    assertEquals("Hop   | Address   | Hostname | Count | Mean  | Min   | Max   | Stdev", lines.get(1));
    assertEquals("1     | 192.0.2.1 | gw       | 3     | 2.000 | 1.000 | 3.000 | 1.000", lines.get(3));
    assertEquals("      | 192.0.2.2 | -        |       |       |       |       |", lines.get(4));
    assertEquals("2     | ???       | -        | 0     | -     | -     | -     | -", lines.get(5));
    assertTrue(lines.get(6).startsWith("Total |"));
  }

  @Test
  void singleSampleHasUndefinedStdev() {
    assertEquals(List.of("1", "4.000", "4.000", "4.000", "n/a"),
        StatsTableWriter.cells(AggregateStats.of(List.of(4.0))));
    assertEquals(List.of("0", "-", "-", "-", "-"), StatsTableWriter.cells(AggregateStats.empty()));
  }

  @Test
  void summariesHaveOneRowPerTarget() {
    writer.writeSummaries(List.of(
        new TargetSummary("a.example", 2, 0, 5, AggregateStats.of(List.of(1.0, 3.0))),
        new TargetSummary("b.example", 0, 1, 0, AggregateStats.empty())));

    List<String> lines = lines();
    assertEquals(4, lines.size());
    assertTrue(lines.get(2).startsWith("a.example | 2    | 0       | 5 "));
    assertTrue(lines.get(3).endsWith("| -"));
  }

  @Test
  void overallPrintsLabelledValues() {
    writer.writeOverall(new OverallSummary(2, 3, 1, OptionalDouble.of(7.5), AggregateStats.of(List.of(2.0, 4.0))));

    List<String> lines = lines();
    assertTrue(lines.contains("Targets               : 2"));
    assertTrue(lines.contains("Average max hops      : 7.500"));
    assertTrue(lines.contains("Mean latency (ms)     : 3.000"));
    assertFalse(buffer.toString().contains("n/a"));
  }

  private List<String> lines() {
    return buffer.toString().lines().toList();
  }
}
