/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.pathtrace.application.port.MetricsPort} adapters.
 * <p><strong>Configuration:</strong> the exporter is chosen from {@code otel.metrics.exporter}
 * ({@code otlp} or {@code none}); {@code none} is the default for CLI runs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.infrastructure.metrics;
