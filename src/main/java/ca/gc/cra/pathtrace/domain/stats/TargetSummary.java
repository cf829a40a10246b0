package ca.gc.cra.pathtrace.domain.stats;

import java.util.Objects;

/**
 * One row of the per-target overview.
 *
 * @param target target name
 * @param runsWithData runs that produced hops
 * @param runsWithoutData runs that produced no hop
 * @param maxHops largest hop count of any run; zero when no run had data
 * @param stats statistics over every sample recorded for the target
 * @since 0.1.0
 */
public record TargetSummary(
    String target, int runsWithData, int runsWithoutData, int maxHops, AggregateStats stats) {

  public TargetSummary {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(stats, "stats");
  }
}
