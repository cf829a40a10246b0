package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry settings out of a command's configuration map into the {@code otel.*} system
 * properties read by the metrics bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;
  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param args mutable configuration map; telemetry keys are removed
   * @return normalized exporter name, {@code none} when unset
   * @throws IllegalArgumentException when a telemetry value is invalid
   */
  static String configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return "none";
    }
    String exporter = trimmed(args.remove("metricsExporter"));
    String normalized = exporter.isEmpty() ? "none" : exporter.toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
    System.setProperty(EXPORTER_PROPERTY, normalized);

    String endpoint = trimmed(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
    }

    String resourceAttributes = trimmed(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL_RESOURCE_ATTRIBUTES override");
      System.setProperty(RESOURCE_PROPERTY, resourceAttributes);
    }
    return normalized;
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
