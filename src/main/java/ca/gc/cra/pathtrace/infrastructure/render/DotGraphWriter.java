package ca.gc.cra.pathtrace.infrastructure.render;

import ca.gc.cra.pathtrace.domain.topology.TopologyGraph;
import java.io.PrintWriter;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes a {@link TopologyGraph} as a Graphviz DOT digraph.
 *
 * <p>Labelled nodes show {@code id\nhostname}; placeholders are dashed boxes and target-tagged terminal
 * nodes get a double outline. Edges are grouped by source node in node order.</p>
 *
 * @since 0.1.0
 */
public final class DotGraphWriter {
  private static final String INDENT = "    ";

  private final PrintWriter out;

  public DotGraphWriter(PrintWriter out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  /**
   * Writes the graph.
   *
   * @param graph graph to render
   */
  public void write(TopologyGraph graph) {
    out.println("digraph pathtrace {");
    out.println(INDENT + "rankdir=LR;");
    out.println(INDENT + "node [shape=ellipse];");
    for (String node : graph.nodes()) {
      out.println(INDENT + quote(node) + " [" + attributes(node, graph.label(node)) + "];");
    }
    for (String node : graph.nodes()) {
      for (String successor : graph.successors(node)) {
        out.println(INDENT + quote(node) + " -> " + quote(successor) + ";");
      }
    }
    out.println("}");
    out.flush();
  }

  private static String attributes(String node, Optional<String> label) {
    StringBuilder attributes = new StringBuilder("label=\"").append(escape(node));
    label.ifPresent(name -> attributes.append("\\n").append(escape(name)));
    attributes.append('"');
    if (TopologyGraph.isPlaceholder(node)) {
      attributes.append(", shape=box, style=dashed");
    }
    if (TopologyGraph.isTagged(node)) {
      attributes.append(", peripheries=2");
    }
    return attributes.toString();
  }

  private static String quote(String id) {
    return '"' + escape(id) + '"';
  }

  private static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
