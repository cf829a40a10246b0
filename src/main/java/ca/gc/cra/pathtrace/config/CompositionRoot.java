package ca.gc.cra.pathtrace.config;

import ca.gc.cra.pathtrace.application.analysis.StatsAggregator;
import ca.gc.cra.pathtrace.application.analysis.TopologyBuilder;
import ca.gc.cra.pathtrace.application.parse.HopLineParser;
import ca.gc.cra.pathtrace.application.pipeline.RunAssembler;
import ca.gc.cra.pathtrace.application.pipeline.TraceRunUseCase;
import ca.gc.cra.pathtrace.application.port.ClockPort;
import ca.gc.cra.pathtrace.application.port.MetricsPort;
import ca.gc.cra.pathtrace.application.port.RunHistoryPort;
import ca.gc.cra.pathtrace.domain.history.RunStore;
import ca.gc.cra.pathtrace.infrastructure.persistence.JsonRunHistoryAdapter;
import ca.gc.cra.pathtrace.infrastructure.time.SystemClockAdapter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires PATHTRACE use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps the CLI classes free of adapter construction so each command only
 * translates arguments and exit codes.</p>
 * <p><strong>Role:</strong> Composition root spanning probe output, assembly, history, and reporting.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root using the system clock.
   *
   * @param metrics metrics sink shared by the created use cases
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new SystemClockAdapter());
  }

  /**
   * Creates a root with an explicit clock.
   *
   * @param metrics metrics sink shared by the created use cases
   * @param clock clock used to timestamp runs
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns a history adapter for the given JSON file.
   *
   * @param store history file
   * @return JSON-backed history port
   */
  public RunHistoryPort runHistory(Path store) {
    return new JsonRunHistoryAdapter(store);
  }

  /**
   * Builds the pipeline that parses probe output and appends the run to {@code store}.
   *
   * @param store history file
   * @return use case ready to consume a probe output source
   */
  public TraceRunUseCase traceRunUseCase(Path store) {
    RunAssembler assembler = new RunAssembler(new HopLineParser(), clock);
    return new TraceRunUseCase(assembler, runHistory(store), metrics);
  }

  public StatsAggregator statsAggregator(RunStore store) {
    return new StatsAggregator(store);
  }

  public TopologyBuilder topologyBuilder(RunStore store) {
    return new TopologyBuilder(store);
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }
}
