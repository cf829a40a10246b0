package ca.gc.cra.pathtrace.domain.topology;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TopologyGraphTest {

  @Test
  void tagsAndStripsTerminalNodes() {
    String tagged = TopologyGraph.tag("93.184.216.34", "example.org");
    assertEquals("93.184.216.34 <example.org>", tagged);
    assertTrue(TopologyGraph.isTagged(tagged));
    assertEquals("93.184.216.34", TopologyGraph.stripTag(tagged));
    assertFalse(TopologyGraph.isTagged("93.184.216.34"));
  }

  @Test
  void recognizesPlaceholdersEvenWhenTagged() {
    assertTrue(TopologyGraph.isPlaceholder("???#3"));
    assertTrue(TopologyGraph.isPlaceholder(TopologyGraph.tag("???#3", "example.org")));
    assertFalse(TopologyGraph.isPlaceholder("10.0.0.1"));
  }

  @Test
  void successorsFollowEdgeOrder() {
    TopologyGraph graph = new TopologyGraph(
        Set.of("a", "b", "c"),
        new LinkedHashSet<>(List.of(new Edge("a", "c"), new Edge("a", "b"))),
        Map.of("a", "gw.example"));
    assertEquals(List.of("c", "b"), graph.successors("a"));
    assertEquals(Optional.of("gw.example"), graph.label("a"));
    assertEquals(Optional.empty(), graph.label("b"));
  }
}
