package ca.gc.cra.pathtrace.domain.stats;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Store-wide summary.
 *
 * @param targetCount number of targets with at least one run
 * @param runsWithData runs that produced hops, across all targets
 * @param runsWithoutData runs that produced no hop, across all targets
 * @param averageMaxHops mean of {@link TargetSummary#maxHops()} over every target, counting a target
 *     whose runs all lack data as zero hops; absent when the store has no target
 * @param stats statistics over every recorded sample
 * @since 0.1.0
 */
public record OverallSummary(
    int targetCount,
    int runsWithData,
    int runsWithoutData,
    OptionalDouble averageMaxHops,
    AggregateStats stats) {

  public OverallSummary {
    Objects.requireNonNull(averageMaxHops, "averageMaxHops");
    Objects.requireNonNull(stats, "stats");
  }
}
