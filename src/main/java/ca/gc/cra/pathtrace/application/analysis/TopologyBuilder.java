package ca.gc.cra.pathtrace.application.analysis;

import ca.gc.cra.pathtrace.domain.history.RunStore;
import ca.gc.cra.pathtrace.domain.probe.HopRecord;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import ca.gc.cra.pathtrace.domain.topology.Edge;
import ca.gc.cra.pathtrace.domain.topology.TopologyGraph;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Merges the runs of one or more targets into a single directed hop graph.
 * <p><strong>Why:</strong> Individual runs only show one path; merging them exposes load-balanced branches
 * and shared upstream routers.</p>
 * <p><strong>Role:</strong> Application service feeding the DOT presenter.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Link every address of a hop to every address of the next hop.</li>
 *   <li>Stand in numbered placeholders ({@code ???#N}) for hops that never answered; within a run, a node
 *       is only ever linked to the placeholder it was first given.</li>
 *   <li>Tag the last hop of each run with the run's target.</li>
 *   <li>Label nodes whose address was reported under exactly one hostname.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Each {@link #buildGraph(Collection)} call keeps its own state; safe for
 * concurrent calls.</p>
 *
 * @implNote Placeholder numbers are unique per build, so unobserved hops of different runs never merge.
 * @since 0.1.0
 */
public final class TopologyBuilder {
  private static final Logger log = LoggerFactory.getLogger(TopologyBuilder.class);

  private final RunStore store;

  public TopologyBuilder(RunStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Builds the graph for the given targets.
   *
   * @param targets targets to include; unknown targets contribute nothing
   * @return merged graph
   */
  public TopologyGraph buildGraph(Collection<String> targets) {
    Objects.requireNonNull(targets, "targets");
    Build build = new Build();
    for (String target : new LinkedHashSet<>(targets)) {
      for (RunResult run : store.history(target)) {
        if (run.hasData()) {
          build.addRun(run);
        }
      }
    }
    TopologyGraph graph = build.finish();
    log.debug("Built topology for {} targets: {} nodes, {} edges",
        targets.size(), graph.nodes().size(), graph.edges().size());
    return graph;
  }

  private static final class Build {
    private final Set<String> nodes = new LinkedHashSet<>();
    private final Set<Edge> edges = new LinkedHashSet<>();
    private final Map<String, Set<String>> namesByAddress = new HashMap<>();
    private int placeholders;

    void addRun(RunResult run) {
      List<HopRecord> hops = run.hops();
      Map<String, String> placeholderAfter = new HashMap<>();
      hops.forEach(this::recordName);

      HopRecord first = hops.get(0);
      List<String> previous = first.addresses().isEmpty()
          ? List.of(nextPlaceholder())
          : new ArrayList<>(first.addresses());
      if (hops.size() == 1) {
        for (String node : previous) {
          nodes.add(tagged(node, run.target()));
        }
        return;
      }
      nodes.addAll(previous);

      for (int i = 1; i < hops.size(); i++) {
        HopRecord hop = hops.get(i);
        boolean last = i == hops.size() - 1;
        Map<String, List<String>> successors = hop.addresses().isEmpty()
            ? placeholdersFor(previous, placeholderAfter)
            : fanOut(previous, hop.addresses());
        Set<String> current = new LinkedHashSet<>();
        successors.forEach((from, targets) -> {
          for (String to : targets) {
            String node = last ? tagged(to, run.target()) : to;
            edges.add(new Edge(from, node));
            current.add(node);
          }
        });
        nodes.addAll(current);
        previous = new ArrayList<>(current);
      }
    }

    private static Map<String, List<String>> fanOut(List<String> predecessors, Set<String> addresses) {
      Map<String, List<String>> successors = new LinkedHashMap<>();
      for (String predecessor : predecessors) {
        successors.put(predecessor, new ArrayList<>(addresses));
      }
      return successors;
    }

    // Each predecessor keeps the placeholder it was first given in this run; newcomers share one.
    private Map<String, List<String>> placeholdersFor(
        List<String> predecessors, Map<String, String> placeholderAfter) {
      Map<String, List<String>> successors = new LinkedHashMap<>();
      String shared = null;
      for (String predecessor : predecessors) {
        String known = placeholderAfter.get(predecessor);
        if (known == null) {
          if (shared == null) {
            shared = nextPlaceholder();
          }
          placeholderAfter.put(predecessor, shared);
          known = shared;
        }
        successors.put(predecessor, List.of(known));
      }
      return successors;
    }

    private void recordName(HopRecord hop) {
      hop.soleAddress().ifPresent(address -> hop.hostname().ifPresent(name ->
          namesByAddress.computeIfAbsent(address, key -> new LinkedHashSet<>()).add(name)));
    }

    private String nextPlaceholder() {
      placeholders++;
      return TopologyGraph.PLACEHOLDER_PREFIX + placeholders;
    }

    private static String tagged(String node, String target) {
      return TopologyGraph.isTagged(node) ? node : TopologyGraph.tag(node, target);
    }

    TopologyGraph finish() {
      Map<String, String> labels = new LinkedHashMap<>();
      for (String node : nodes) {
        Set<String> names = namesByAddress.get(TopologyGraph.stripTag(node));
        if (names != null && names.size() == 1) {
          labels.put(node, names.iterator().next());
        }
      }
      return new TopologyGraph(nodes, edges, labels);
    }
  }
}
