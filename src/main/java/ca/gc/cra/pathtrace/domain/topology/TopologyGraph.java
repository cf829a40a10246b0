package ca.gc.cra.pathtrace.domain.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Directed graph of network hops merged across runs.
 * <p><strong>Node ids:</strong> a responding address ({@code 192.0.2.1}), a placeholder for an unobserved
 * hop ({@code ???#3}), or a terminal node tagged with the run's target ({@code 192.0.2.9 <example.org>}).</p>
 * <p><strong>Labels:</strong> node id to hostname, only for nodes whose address was reported under exactly
 * one name.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; collections keep insertion order.</p>
 *
 * @param nodes node ids in first-seen order
 * @param edges distinct edges in first-seen order
 * @param labels hostname per labelled node id
 * @since 0.1.0
 */
public record TopologyGraph(Set<String> nodes, Set<Edge> edges, Map<String, String> labels) {
  /** Prefix of node ids synthesized for hops that never answered. */
  public static final String PLACEHOLDER_PREFIX = "???#";

  private static final String TAG_OPEN = " <";

  public TopologyGraph {
    nodes = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(nodes, "nodes")));
    edges = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(edges, "edges")));
    labels = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(labels, "labels")));
  }

  /**
   * Returns the label of a node.
   *
   * @param node node id
   * @return hostname when the node is labelled
   */
  public Optional<String> label(String node) {
    return Optional.ofNullable(labels.get(node));
  }

  /**
   * Returns the direct successors of a node.
   *
   * @param node node id
   * @return successor ids in edge order
   */
  public List<String> successors(String node) {
    List<String> result = new ArrayList<>();
    for (Edge edge : edges) {
      if (edge.from().equals(node)) {
        result.add(edge.to());
      }
    }
    return result;
  }

  /**
   * Formats the id of a terminal node.
   *
   * @param address node id of the last hop
   * @param target run target
   * @return {@code "<address> <target>"}
   */
  public static String tag(String address, String target) {
    return String.format("%s <%s>", address, target);
  }

  /**
   * Indicates whether a node id already carries a target tag.
   *
   * @param node node id
   * @return {@code true} for ids produced by {@link #tag(String, String)}
   */
  public static boolean isTagged(String node) {
    return node.endsWith(">") && node.contains(TAG_OPEN);
  }

  /**
   * Removes a target tag, returning the underlying address or placeholder.
   *
   * @param node node id
   * @return untagged id
   */
  public static String stripTag(String node) {
    if (!isTagged(node)) {
      return node;
    }
    return node.substring(0, node.indexOf(TAG_OPEN));
  }

  public static boolean isPlaceholder(String node) {
    return stripTag(node).startsWith(PLACEHOLDER_PREFIX);
  }
}
