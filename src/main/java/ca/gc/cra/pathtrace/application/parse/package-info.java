/**
 * Hop line parsing over dialect-classified tokens.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.application.parse;
