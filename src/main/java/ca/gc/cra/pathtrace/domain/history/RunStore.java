package ca.gc.cra.pathtrace.domain.history;

import ca.gc.cra.pathtrace.domain.probe.RunResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <strong>What:</strong> Append-only, per-target history of completed runs.
 * <p><strong>Why:</strong> Statistics and topology are computed over every run ever recorded for a target,
 * in the order the runs were taken.</p>
 * <p><strong>Role:</strong> In-memory domain aggregate loaded from and mirrored to a {@code RunHistoryPort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep runs grouped by target in insertion (chronological) order.</li>
 *   <li>Expose immutable snapshots to readers.</li>
 *   <li>Summarize how many runs per target carried data.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One writer may append while any number of readers take snapshots;
 * runs are never edited or removed.</p>
 *
 * @since 0.1.0
 */
public final class RunStore {
  private final ConcurrentNavigableMap<String, List<RunResult>> runsByTarget =
      new ConcurrentSkipListMap<>();

  /**
   * Appends a run to the history of its target.
   *
   * @param run completed run; must not be {@code null}
   */
  public void append(RunResult run) {
    Objects.requireNonNull(run, "run");
    runsByTarget.computeIfAbsent(run.target(), key -> new CopyOnWriteArrayList<>()).add(run);
  }

  /**
   * Returns a snapshot of every run recorded for a target.
   *
   * @param target target name
   * @return runs in insertion order; empty for an unknown target
   */
  public List<RunResult> history(String target) {
    List<RunResult> runs = target == null ? null : runsByTarget.get(target);
    return runs == null ? List.of() : List.copyOf(runs);
  }

  /**
   * Returns every target with at least one run.
   *
   * @return targets in lexicographic order
   */
  public List<String> targets() {
    return List.copyOf(runsByTarget.keySet());
  }

  /**
   * Counts runs with and without hop data per target.
   *
   * @return one entry per target, in {@link #targets()} order
   */
  public List<TargetInventory> inventory() {
    List<TargetInventory> rows = new ArrayList<>();
    for (Map.Entry<String, List<RunResult>> entry : runsByTarget.entrySet()) {
      int withData = 0;
      int withoutData = 0;
      for (RunResult run : entry.getValue()) {
        if (run.hasData()) {
          withData++;
        } else {
          withoutData++;
        }
      }
      rows.add(new TargetInventory(entry.getKey(), withData, withoutData));
    }
    return List.copyOf(rows);
  }

  /**
   * Returns the total number of runs across all targets.
   *
   * @return run count
   */
  public int size() {
    int total = 0;
    for (List<RunResult> runs : runsByTarget.values()) {
      total += runs.size();
    }
    return total;
  }

  public boolean isEmpty() {
    return runsByTarget.isEmpty();
  }
}
