/**
 * <strong>Purpose:</strong> Multi-run analysis: latency statistics and topology reconstruction.
 * <p><strong>Concurrency:</strong> Services read {@link ca.gc.cra.pathtrace.domain.history.RunStore}
 * snapshots and never mutate them.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.application.analysis;
