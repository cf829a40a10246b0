/**
 * <strong>Purpose:</strong> Logging helpers: verbosity control and truncation of raw probe lines.
 * <p><strong>Concurrency:</strong> Stateless utilities.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.logging;
