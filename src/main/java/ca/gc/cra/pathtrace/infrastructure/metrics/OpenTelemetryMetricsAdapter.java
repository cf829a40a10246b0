package ca.gc.cra.pathtrace.infrastructure.metrics;

import ca.gc.cra.pathtrace.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Metrics adapter that forwards PATHTRACE counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily, one per metric key; every data point carries the key as the
 * {@code pathtrace.metric.key} attribute.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("pathtrace.metric.key");

  private final OpenTelemetryBootstrap.MeterHandle telemetry;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter configured through {@code otel.*} properties.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle telemetry) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.meter = telemetry.meter();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    LongCounter counter = counters.computeIfAbsent(key, name -> meter
        .counterBuilder(name)
        .setUnit("1")
        .setDescription("PATHTRACE counter for " + name)
        .build());
    counter.add(1, attributes(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    LongHistogram histogram = histograms.computeIfAbsent(key, name -> meter
        .histogramBuilder(name)
        .ofLongs()
        .setDescription("PATHTRACE observation for " + name)
        .build());
    histogram.record(value, attributes(key));
  }

  boolean isNoop() {
    return telemetry.isNoop();
  }

  void forceFlush() {
    telemetry.flush();
  }

  /**
   * Flushes pending data points and shuts the meter provider down.
   */
  @Override
  public void close() {
    telemetry.close();
  }

  private static Attributes attributes(String key) {
    return Attributes.of(METRIC_KEY_ATTRIBUTE, key);
  }
}
