/**
 * <strong>Purpose:</strong> Input validation helpers shared by CLI, configuration, and token classification.
 * <p><strong>Concurrency:</strong> Stateless utilities; thread-safe.
 * <p><strong>Errors:</strong> Violations surface as {@link java.lang.IllegalArgumentException} with
 * {@code <name> must ...} messages so CLI callers can print them verbatim.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.validation;
