package ca.gc.cra.pathtrace.domain.stats;

import java.util.List;
import java.util.Objects;

/**
 * Per-hop latency table for one target.
 *
 * @param target target name
 * @param runsWithData runs that produced hops
 * @param runsWithoutData runs that produced no hop
 * @param hops one row per hop index seen in any run, ascending
 * @param total statistics over every sample of every hop
 * @since 0.1.0
 */
public record TargetStats(
    String target, int runsWithData, int runsWithoutData, List<HopStats> hops, AggregateStats total) {

  public TargetStats {
    Objects.requireNonNull(target, "target");
    hops = List.copyOf(Objects.requireNonNull(hops, "hops"));
    Objects.requireNonNull(total, "total");
  }
}
