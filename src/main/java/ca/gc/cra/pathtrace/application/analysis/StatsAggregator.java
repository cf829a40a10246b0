package ca.gc.cra.pathtrace.application.analysis;

import ca.gc.cra.pathtrace.domain.history.RunStore;
import ca.gc.cra.pathtrace.domain.probe.HopRecord;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import ca.gc.cra.pathtrace.domain.stats.AggregateStats;
import ca.gc.cra.pathtrace.domain.stats.HopHost;
import ca.gc.cra.pathtrace.domain.stats.HopStats;
import ca.gc.cra.pathtrace.domain.stats.OverallSummary;
import ca.gc.cra.pathtrace.domain.stats.TargetStats;
import ca.gc.cra.pathtrace.domain.stats.TargetSummary;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Computes latency statistics over the runs held in a {@link RunStore}.
 * <p><strong>Why:</strong> Individual runs are noisy; operators compare hops and targets over many runs.</p>
 * <p><strong>Role:</strong> Application service feeding the statistics presenters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge samples by hop index across every run with data.</li>
 *   <li>Collect the addresses (and names) seen at each hop index.</li>
 *   <li>Summarize each target and the whole store.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Reads immutable snapshots; safe to call concurrently with appends.</p>
 *
 * @since 0.1.0
 * @see AggregateStats
 */
public final class StatsAggregator {
  private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

  private final RunStore store;

  public StatsAggregator(RunStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Builds the per-hop statistics table of one target.
   *
   * @param target target name
   * @return statistics; every count is zero when the target has no run with data
   */
  public TargetStats statsFor(String target) {
    List<RunResult> runs = store.history(target);
    SortedMap<Integer, List<Double>> samplesByIndex = new TreeMap<>();
    SortedMap<Integer, Map<String, Optional<String>>> hostsByIndex = new TreeMap<>();
    List<Double> all = new ArrayList<>();
    int withData = 0;
    for (RunResult run : runs) {
      if (!run.hasData()) {
        continue;
      }
      withData++;
      for (HopRecord hop : run.hops()) {
        List<Double> samples = samplesByIndex.computeIfAbsent(hop.index(), key -> new ArrayList<>());
        samples.addAll(hop.samples());
        all.addAll(hop.samples());
        Map<String, Optional<String>> hosts =
            hostsByIndex.computeIfAbsent(hop.index(), key -> new LinkedHashMap<>());
        for (String address : hop.addresses()) {
          hosts.putIfAbsent(address, Optional.empty());
        }
        hop.soleAddress().ifPresent(address -> {
          if (hop.hostname().isPresent() && hosts.get(address).isEmpty()) {
            hosts.put(address, hop.hostname());
          }
        });
      }
    }

    List<HopStats> rows = new ArrayList<>(samplesByIndex.size());
    for (Map.Entry<Integer, List<Double>> entry : samplesByIndex.entrySet()) {
      List<HopHost> hosts = new ArrayList<>();
      hostsByIndex.get(entry.getKey()).forEach((address, name) -> hosts.add(new HopHost(address, name)));
      rows.add(new HopStats(entry.getKey(), hosts, AggregateStats.of(entry.getValue())));
    }
    log.debug("Aggregated {} hop indices over {} runs for {}", rows.size(), withData, target);
    return new TargetStats(target, withData, runs.size() - withData, rows, AggregateStats.of(all));
  }

  /**
   * Summarizes every target of the store.
   *
   * @return one row per target, in lexicographic target order
   */
  public List<TargetSummary> statsForAll() {
    List<TargetSummary> rows = new ArrayList<>();
    for (String target : store.targets()) {
      rows.add(summarize(target));
    }
    return List.copyOf(rows);
  }

  /**
   * Summarizes the whole store.
   *
   * @return store-wide summary
   */
  public OverallSummary overall() {
    List<String> targets = store.targets();
    List<Double> all = new ArrayList<>();
    int withData = 0;
    int withoutData = 0;
    long maxHopsSum = 0;
    for (String target : targets) {
      int targetMaxHops = 0;
      for (RunResult run : store.history(target)) {
        if (!run.hasData()) {
          withoutData++;
          continue;
        }
        withData++;
        targetMaxHops = Math.max(targetMaxHops, run.hops().size());
        collectSamples(run, all);
      }
      maxHopsSum += targetMaxHops;
    }
    OptionalDouble averageMaxHops = targets.isEmpty()
        ? OptionalDouble.empty()
        : OptionalDouble.of((double) maxHopsSum / targets.size());
    return new OverallSummary(targets.size(), withData, withoutData, averageMaxHops, AggregateStats.of(all));
  }

  private TargetSummary summarize(String target) {
    List<Double> samples = new ArrayList<>();
    int withData = 0;
    int withoutData = 0;
    int maxHops = 0;
    for (RunResult run : store.history(target)) {
      if (!run.hasData()) {
        withoutData++;
        continue;
      }
      withData++;
      maxHops = Math.max(maxHops, run.hops().size());
      collectSamples(run, samples);
    }
    return new TargetSummary(target, withData, withoutData, maxHops, AggregateStats.of(samples));
  }

  private static void collectSamples(RunResult run, List<Double> sink) {
    for (HopRecord hop : run.hops()) {
      sink.addAll(hop.samples());
    }
  }
}
