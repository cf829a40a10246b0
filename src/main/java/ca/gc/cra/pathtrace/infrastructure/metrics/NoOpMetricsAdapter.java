package ca.gc.cra.pathtrace.infrastructure.metrics;

import ca.gc.cra.pathtrace.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; used when {@code metricsExporter=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
