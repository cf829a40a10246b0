package ca.gc.cra.pathtrace.domain.stats;

import java.util.List;
import java.util.Objects;

/**
 * Latency statistics for one hop index across all runs of a target.
 *
 * @param index hop index
 * @param hosts addresses seen at this index in first-seen order; a single {@code ???} entry when none
 * @param stats statistics over every sample recorded at this index
 * @since 0.1.0
 */
public record HopStats(int index, List<HopHost> hosts, AggregateStats stats) {

  public HopStats {
    hosts = List.copyOf(Objects.requireNonNull(hosts, "hosts"));
    if (hosts.isEmpty()) {
      hosts = List.of(HopHost.unknown());
    }
    Objects.requireNonNull(stats, "stats");
  }
}
