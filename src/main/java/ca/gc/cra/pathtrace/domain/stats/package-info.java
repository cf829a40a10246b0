/**
 * <strong>Purpose:</strong> Latency statistics value types produced by
 * {@link ca.gc.cra.pathtrace.application.analysis.StatsAggregator}.
 * <p><strong>Concurrency:</strong> Immutable records.
 * <p><strong>Conventions:</strong> Absent values use {@link java.util.OptionalDouble}; no value is ever
 * {@code NaN}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.domain.stats;
