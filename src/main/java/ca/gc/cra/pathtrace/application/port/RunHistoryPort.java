package ca.gc.cra.pathtrace.application.port;

import ca.gc.cra.pathtrace.domain.history.RunStore;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import java.io.IOException;

/**
 * <strong>What:</strong> Port for durable run histories.
 * <p><strong>Why:</strong> Aggregation works over many runs collected across invocations; the history
 * must outlive the process.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code JsonRunHistoryAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations document their guarantees; the JSON file adapter
 * does not serialize concurrent writers across processes.</p>
 *
 * @since 0.1.0
 */
public interface RunHistoryPort {
  /**
   * Loads every persisted run into a fresh store.
   *
   * @return store holding all runs in persisted order; empty when nothing was recorded yet
   * @throws IOException if the history exists but cannot be read or decoded
   */
  RunStore load() throws IOException;

  /**
   * Appends one run without altering previously persisted runs.
   *
   * @param run completed run; must not be {@code null}
   * @throws IOException if the history cannot be updated
   */
  void append(RunResult run) throws IOException;
}
