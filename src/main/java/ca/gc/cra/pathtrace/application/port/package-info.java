/**
 * Ports used by the run pipeline: probe output input, run history persistence, clock, and metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.application.port;
