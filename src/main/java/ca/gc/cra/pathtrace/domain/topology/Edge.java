package ca.gc.cra.pathtrace.domain.topology;

import java.util.Objects;

/**
 * Directed link between two consecutive hops.
 *
 * @param from node id of the nearer hop
 * @param to node id of the farther hop
 * @since 0.1.0
 */
public record Edge(String from, String to) {

  public Edge {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
  }
}
