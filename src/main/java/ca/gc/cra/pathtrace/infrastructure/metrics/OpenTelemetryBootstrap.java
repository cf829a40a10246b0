package ca.gc.cra.pathtrace.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter PATHTRACE records run metrics with.
 *
 * <p>Settings come from {@code otel.*} system properties (set by the CLI from {@code metricsExporter=},
 * {@code otelEndpoint=} and {@code otelResourceAttributes=}) with {@code OTEL_*} environment variables as
 * fallback. Anything but {@code otlp} yields a no-op meter. A command records a single run and exits, so
 * {@link MeterHandle#close()} flushes before shutting the provider down instead of waiting for the next
 * export interval.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.pathtrace";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_SECONDS = 5;

  private OpenTelemetryBootstrap() {}

  /** Exporter settings resolved from system properties and the environment. */
  record ExporterSettings(String exporter, String endpoint, String resourceAttributes) {
    static ExporterSettings fromEnvironment() {
      return new ExporterSettings(
          lookup("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none"),
          lookup("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", "http://localhost:4317"),
          lookup("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
    }

    boolean otlp() {
      return "otlp".equals(exporter.toLowerCase(Locale.ROOT));
    }

    private static String lookup(String property, String variable, String fallback) {
      return Optional.ofNullable(System.getProperty(property))
          .or(() -> Optional.ofNullable(System.getenv(variable)))
          .map(String::trim)
          .filter(value -> !value.isEmpty())
          .orElse(fallback);
    }
  }

  /**
   * Meter plus the SDK provider behind it; the provider is absent for the no-op meter.
   *
   * @param meter meter instruments are created from
   * @param provider SDK provider to flush and shut down
   */
  record MeterHandle(Meter meter, Optional<SdkMeterProvider> provider) implements AutoCloseable {
    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), Optional.empty());
    }

    boolean isNoop() {
      return provider.isEmpty();
    }

    void flush() {
      provider.ifPresent(sdk -> await(sdk.forceFlush(), "flush"));
    }

    @Override
    public void close() {
      provider.ifPresent(sdk -> {
        await(sdk.forceFlush(), "flush");
        await(sdk.shutdown(), "shutdown");
      });
    }

    private static void await(CompletableResultCode pending, String step) {
      if (!pending.join(SHUTDOWN_SECONDS, TimeUnit.SECONDS).isSuccess()) {
        log.warn("OpenTelemetry metrics {} did not complete within {}s", step, SHUTDOWN_SECONDS);
      }
    }
  }

  static MeterHandle initialize() {
    return initialize(ExporterSettings.fromEnvironment());
  }

  static MeterHandle initialize(ExporterSettings settings) {
    if (!settings.otlp()) {
      log.debug("Run metrics not exported (exporter={})", settings.exporter());
      return MeterHandle.noop();
    }
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      MeterHandle handle = start(reader, parseResourceAttributes(settings.resourceAttributes()));
      log.info("Exporting run metrics over OTLP to {}", settings.endpoint());
      return handle;
    } catch (RuntimeException ex) {
      log.error("OTLP metrics exporter could not start; run metrics will not be exported", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle forTesting(MetricReader reader) {
    return start(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static MeterHandle start(MetricReader reader, Attributes extra) {
    String version = Optional.ofNullable(OpenTelemetryBootstrap.class.getPackage())
        .map(Package::getImplementationVersion)
        .orElse("0.0.0-dev");
    Resource resource = Resource.getDefault().toBuilder()
        .put("service.name", "pathtrace")
        .put("service.namespace", "ca.gc.cra")
        .put("service.version", version)
        .putAll(extra)
        .build();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new MeterHandle(meter, Optional.of(provider));
  }

  /**
   * Parses {@code key=value,key=value} resource attributes; malformed entries are logged and skipped.
   *
   * @param raw attribute list, possibly blank
   * @return parsed attributes
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder attributes = Attributes.builder();
    if (raw == null) {
      return attributes.build();
    }
    for (String entry : raw.split(",")) {
      String[] pair = entry.split("=", 2);
      if (pair.length != 2 || pair[0].isBlank() || pair[1].isBlank()) {
        if (!entry.isBlank()) {
          log.warn("Skipping resource attribute '{}': expected key=value", entry.trim());
        }
        continue;
      }
      attributes.put(AttributeKey.stringKey(pair[0].trim()), pair[1].trim());
    }
    return attributes.build();
  }
}
