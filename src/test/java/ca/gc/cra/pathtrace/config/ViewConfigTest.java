package ca.gc.cra.pathtrace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ViewConfigTest {

  @Test
  void actionDefaultsToInfo() {
    ViewConfig config = ViewConfig.fromMap(Map.of("store", "history.json"));

    assertEquals(Path.of("history.json"), config.store());
    assertEquals(ViewAction.INFO, config.action());
    assertEquals(List.of(), config.targets());
    assertEquals(Optional.empty(), config.out());
  }

  @Test
  void readsTargetsAndOutput() {
    ViewConfig config = ViewConfig.fromMap(Map.of(
        "store", "history.json", "action", "Map", "targets", "a.example,,b.example", "out", "graph.dot"));

    assertEquals(ViewAction.MAP, config.action());
    assertEquals(List.of("a.example", "b.example"), config.targets());
    assertEquals(Optional.of(Path.of("graph.dot")), config.out());
  }

  @Test
  void rejectsMissingStoreAndUnknownAction() {
    assertThrows(IllegalArgumentException.class, () -> ViewConfig.fromMap(Map.of("action", "stats")));
    assertThrows(IllegalArgumentException.class,
        () -> ViewConfig.fromMap(Map.of("store", "history.json", "action", "chart")));
  }
}
