/**
 * Run histories grouped by target.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.domain.history;
