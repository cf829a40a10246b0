/**
 * Reconstructed network topology.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.domain.topology;
