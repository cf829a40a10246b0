package ca.gc.cra.pathtrace.domain.history;

import static ca.gc.cra.pathtrace.testutil.ProbeFixtures.emptyRun;
import static ca.gc.cra.pathtrace.testutil.ProbeFixtures.hop;
import static ca.gc.cra.pathtrace.testutil.ProbeFixtures.run;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pathtrace.domain.probe.RunResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class RunStoreTest {

  @Test
  void keepsRunsPerTargetInInsertionOrder() {
    RunStore store = new RunStore();
    RunResult first = run("example.org", hop(1, "10.0.0.1", 1.0));
    RunResult second = emptyRun("example.org");
    store.append(first);
    store.append(run("a.example", hop(1, "10.0.0.9", 2.0)));
    store.append(second);

    assertEquals(List.of(first, second), store.history("example.org"));
    assertEquals(List.of("a.example", "example.org"), store.targets());
    assertEquals(3, store.size());
  }

  @Test
  void unknownTargetHasEmptyHistory() {
    RunStore store = new RunStore();
    assertTrue(store.history("missing.example").isEmpty());
    assertTrue(store.history(null).isEmpty());
    assertTrue(store.isEmpty());
  }

  @Test
  void historyIsASnapshot() {
    RunStore store = new RunStore();
    store.append(emptyRun("example.org"));
    List<RunResult> snapshot = store.history("example.org");
    store.append(emptyRun("example.org"));

    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(emptyRun("example.org")));
  }

  @Test
  void inventorySeparatesRunsWithoutData() {
    RunStore store = new RunStore();
    store.append(run("example.org", hop(1, "10.0.0.1", 1.0)));
    store.append(emptyRun("example.org"));
    store.append(emptyRun("example.org"));

    TargetInventory row = store.inventory().get(0);
    assertEquals(new TargetInventory("example.org", 1, 2), row);
    assertEquals(3, row.totalRuns());
  }
}
