package ca.gc.cra.pathtrace.infrastructure.render;

import ca.gc.cra.pathtrace.domain.history.TargetInventory;
import ca.gc.cra.pathtrace.domain.stats.AggregateStats;
import ca.gc.cra.pathtrace.domain.stats.HopHost;
import ca.gc.cra.pathtrace.domain.stats.HopStats;
import ca.gc.cra.pathtrace.domain.stats.OverallSummary;
import ca.gc.cra.pathtrace.domain.stats.TargetStats;
import ca.gc.cra.pathtrace.domain.stats.TargetSummary;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Renders inventories and latency statistics as aligned plain-text tables.
 *
 * <p>Absent values print as {@code -}; a standard deviation that is undefined because only one sample
 * exists prints as {@code n/a}. Latencies are milliseconds with three decimals.</p>
 *
 * @since 0.1.0
 */
public final class StatsTableWriter {
  static final String ABSENT = "-";
  static final String UNDEFINED = "n/a";
  private static final List<String> STAT_COLUMNS = List.of("Count", "Mean", "Min", "Max", "Stdev");

  private final PrintWriter out;

  public StatsTableWriter(PrintWriter out) {
    this.out = out;
  }

  /**
   * Writes store-wide run counts; the empty-run line only appears when such runs exist.
   *
   * @param inventory rows from {@code RunStore.inventory()}
   */
  public void writeInfo(List<TargetInventory> inventory) {
    int runs = 0;
    int empty = 0;
    for (TargetInventory row : inventory) {
      runs += row.totalRuns();
      empty += row.runsWithoutData();
    }
    out.println("Targets               : " + inventory.size());
    out.println("Runs                  : " + runs);
    if (empty > 0) {
      out.println("Runs without data     : " + empty);
    }
    out.flush();
  }

  /**
   * Writes run counts per target.
   *
   * @param inventory rows from {@code RunStore.inventory()}
   */
  public void writeInventory(List<TargetInventory> inventory) {
    List<List<String>> rows = new ArrayList<>();
    for (TargetInventory row : inventory) {
      rows.add(List.of(
          row.target(),
          Integer.toString(row.totalRuns()),
          Integer.toString(row.runsWithData()),
          Integer.toString(row.runsWithoutData())));
    }
    table(List.of("Target", "Runs", "With data", "No data"), rows);
  }

  /**
   * Writes the per-hop table of one target, one line per address seen at each hop.
   *
   * @param stats statistics of the target
   */
  public void writeTargetStats(TargetStats stats) {
    out.println("Target: " + stats.target() + " (runs with data: " + stats.runsWithData()
        + ", without data: " + stats.runsWithoutData() + ")");
    List<String> header = new ArrayList<>(List.of("Hop", "Address", "Hostname"));
    header.addAll(STAT_COLUMNS);
    List<List<String>> rows = new ArrayList<>();
    for (HopStats hop : stats.hops()) {
      boolean first = true;
      for (HopHost host : hop.hosts()) {
        List<String> row = new ArrayList<>();
        row.add(first ? Integer.toString(hop.index()) : "");
        row.add(host.address());
        row.add(host.hostname().orElse(ABSENT));
        if (first) {
          row.addAll(cells(hop.stats()));
        } else {
          STAT_COLUMNS.forEach(column -> row.add(""));
        }
        rows.add(row);
        first = false;
      }
    }
    List<String> total = new ArrayList<>(List.of("Total", "", ""));
    total.addAll(cells(stats.total()));
    rows.add(total);
    table(header, rows);
  }

  /**
   * Writes one summary row per target.
   *
   * @param summaries rows from {@code StatsAggregator.statsForAll()}
   */
  public void writeSummaries(List<TargetSummary> summaries) {
    List<String> header = new ArrayList<>(List.of("Target", "Runs", "No data", "Max hops"));
    header.addAll(STAT_COLUMNS);
    List<List<String>> rows = new ArrayList<>();
    for (TargetSummary summary : summaries) {
      List<String> row = new ArrayList<>(List.of(
          summary.target(),
          Integer.toString(summary.runsWithData()),
          Integer.toString(summary.runsWithoutData()),
          Integer.toString(summary.maxHops())));
      row.addAll(cells(summary.stats()));
      rows.add(row);
    }
    table(header, rows);
  }

  /**
   * Writes the store-wide summary as {@code label: value} lines.
   *
   * @param overall summary from {@code StatsAggregator.overall()}
   */
  public void writeOverall(OverallSummary overall) {
    List<String> cells = cells(overall.stats());
    out.println("Targets               : " + overall.targetCount());
    out.println("Runs with data        : " + overall.runsWithData());
    out.println("Runs without data     : " + overall.runsWithoutData());
    out.println("Average max hops      : " + format(overall.averageMaxHops(), ABSENT));
    out.println("Samples               : " + cells.get(0));
    out.println("Mean latency (ms)     : " + cells.get(1));
    out.println("Min latency (ms)      : " + cells.get(2));
    out.println("Max latency (ms)      : " + cells.get(3));
    out.println("Latency stdev (ms)    : " + cells.get(4));
    out.flush();
  }

  static List<String> cells(AggregateStats stats) {
    return List.of(
        Integer.toString(stats.count()),
        format(stats.mean(), ABSENT),
        format(stats.min(), ABSENT),
        format(stats.max(), ABSENT),
        format(stats.stdev(), stats.isEmpty() ? ABSENT : UNDEFINED));
  }

  private static String format(OptionalDouble value, String missing) {
    return value.isPresent() ? String.format(Locale.ROOT, "%.3f", value.getAsDouble()) : missing;
  }

  private void table(List<String> header, List<List<String>> rows) {
    int[] widths = new int[header.size()];
    for (int i = 0; i < widths.length; i++) {
      widths[i] = header.get(i).length();
    }
    for (List<String> row : rows) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], row.get(i).length());
      }
    }
    out.println(line(header, widths));
    StringBuilder rule = new StringBuilder();
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) {
        rule.append("-+-");
      }
      rule.append("-".repeat(widths[i]));
    }
    out.println(rule);
    for (List<String> row : rows) {
      out.println(line(row, widths));
    }
    out.flush();
  }

  private static String line(List<String> cells, int[] widths) {
    StringBuilder line = new StringBuilder();
    for (int i = 0; i < widths.length; i++) {
      if (i > 0) {
        line.append(" | ");
      }
      String cell = cells.get(i);
      line.append(cell).append(" ".repeat(widths[i] - cell.length()));
    }
    return line.toString().stripTrailing();
  }
}
