/**
 * Probe output sources backed by captured text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.infrastructure.io;
