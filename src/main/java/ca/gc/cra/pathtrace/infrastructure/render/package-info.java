/**
 * Plain-text presenters for statistics and topology.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.infrastructure.render;
