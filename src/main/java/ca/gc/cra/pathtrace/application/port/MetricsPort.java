package ca.gc.cra.pathtrace.application.port;

/**
 * <strong>What:</strong> Port abstracting PATHTRACE metrics emission.
 * <p><strong>Why:</strong> Lets the run pipeline count runs and hops without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract ({@code trace.runs.completed},
 * {@code trace.run.durationMillis}, ...).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier such as {@code trace.hops.parsed}; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, with units named by the key
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
