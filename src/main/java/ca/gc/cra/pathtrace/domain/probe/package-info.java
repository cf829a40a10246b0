/**
 * <strong>Purpose:</strong> Probe output vocabulary: dialect rules, classified tokens, hop records, and
 * completed runs.
 * <p><strong>Pipeline role:</strong> Domain layer shared by parsing, persistence, and analysis.
 * <p><strong>Concurrency:</strong> All types are immutable.
 * <p><strong>Errors:</strong> {@link ca.gc.cra.pathtrace.domain.probe.ProbeOutputException} subtypes abort
 * a single run; {@link ca.gc.cra.pathtrace.domain.probe.UnknownDialectException} is raised while
 * configuring.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.domain.probe;
