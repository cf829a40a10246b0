package ca.gc.cra.pathtrace.application.pipeline;

import ca.gc.cra.pathtrace.application.port.MetricsPort;
import ca.gc.cra.pathtrace.application.port.ProbeOutputSource;
import ca.gc.cra.pathtrace.application.port.RunHistoryPort;
import ca.gc.cra.pathtrace.domain.probe.ProbeOutputException;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Records one probe run: assemble its output, then append it to the run history.
 * <p><strong>Why:</strong> Shared by the {@code trace} (live process) and {@code ingest} (captured output)
 * commands so both produce identical history entries.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating {@link RunAssembler} and
 * {@link RunHistoryPort}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time.</p>
 * <p><strong>Observability:</strong> Sets MDC keys {@code trace.target} and {@code trace.dialect}; emits
 * {@code trace.runs.completed}, {@code trace.runs.nodata}, {@code trace.runs.failed},
 * {@code trace.hops.parsed} and {@code trace.run.durationMillis}.</p>
 *
 * @since 0.1.0
 */
public final class TraceRunUseCase {
  private static final Logger log = LoggerFactory.getLogger(TraceRunUseCase.class);
  static final String MDC_TARGET = "trace.target";
  static final String MDC_DIALECT = "trace.dialect";

  private final RunAssembler assembler;
  private final RunHistoryPort history;
  private final MetricsPort metrics;

  public TraceRunUseCase(RunAssembler assembler, RunHistoryPort history, MetricsPort metrics) {
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.history = Objects.requireNonNull(history, "history");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Assembles the source into a run and appends it to the history. The source is closed on return.
   *
   * @param source probe output to consume
   * @return the recorded run
   * @throws ProbeOutputException if the output cannot be assembled; nothing is appended
   * @throws IOException if reading the source or writing the history fails
   */
  public RunResult run(ProbeOutputSource source) throws ProbeOutputException, IOException {
    Objects.requireNonNull(source, "source");
    String previousTarget = MDC.get(MDC_TARGET);
    String previousDialect = MDC.get(MDC_DIALECT);
    MDC.put(MDC_TARGET, source.target());
    MDC.put(MDC_DIALECT, source.dialect().name().toLowerCase(Locale.ROOT));
    try (ProbeOutputSource input = source) {
      log.info("Recording run to {} via '{}'", input.target(), input.command());
      RunResult run;
      try {
        run = assembler.assemble(input);
      } catch (ProbeOutputException ex) {
        metrics.increment("trace.runs.failed");
        log.warn("Run to {} aborted: {}", input.target(), ex.getMessage());
        throw ex;
      }
      history.append(run);
      recordMetrics(run);
      if (run.hasData()) {
        log.info("Recorded {} hops to {} in {} s", run.hops().size(), run.target(),
            String.format(Locale.ROOT, "%.3f", run.durationSeconds()));
      } else {
        log.warn("Run to {} produced no hop data", run.target());
      }
      return run;
    } finally {
      restore(MDC_TARGET, previousTarget);
      restore(MDC_DIALECT, previousDialect);
    }
  }

  private void recordMetrics(RunResult run) {
    metrics.increment(run.hasData() ? "trace.runs.completed" : "trace.runs.nodata");
    for (int i = 0; i < run.hops().size(); i++) {
      metrics.increment("trace.hops.parsed");
    }
    metrics.observe("trace.run.durationMillis", Math.round(run.durationSeconds() * 1000d));
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
