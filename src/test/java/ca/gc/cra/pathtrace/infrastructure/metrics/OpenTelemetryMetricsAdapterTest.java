package ca.gc.cra.pathtrace.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY = AttributeKey.stringKey("pathtrace.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("trace.hops.parsed");
    adapter.increment("trace.hops.parsed");
    adapter.increment("trace.hops.parsed");
    adapter.forceFlush();

    MetricData counter = find("trace.hops.parsed").orElseThrow();
    assertFalse(adapter.isNoop());
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("trace.hops.parsed", point.getAttributes().get(KEY));
    assertEquals("pathtrace", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("trace.run.durationMillis", 1_500L);
    adapter.observe("trace.run.durationMillis", 500L);
    adapter.forceFlush();

    MetricData histogram = find("trace.run.durationMillis").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(2_000d, point.getSum());
    assertEquals("trace.run.durationMillis", point.getAttributes().get(KEY));
  }

  @Test
  void unusedKeysExportNothing() {
    adapter.increment("trace.runs.completed");

    assertTrue(find("trace.runs.failed").isEmpty());
  }

  private Optional<MetricData> find(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst();
  }
}
