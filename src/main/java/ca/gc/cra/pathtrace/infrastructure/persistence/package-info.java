/**
 * <strong>Purpose:</strong> JSON run history files.
 * <p><strong>Format:</strong> one object mapping target to an array of run objects, written with sorted keys
 * and four-space indentation; see {@link ca.gc.cra.pathtrace.infrastructure.persistence.RunJsonMapper}.
 * <p><strong>Concurrency:</strong> Appends are unserialized read-modify-write cycles; callers sharing a file
 * across processes must coordinate.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.infrastructure.persistence;
