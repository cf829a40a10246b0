/**
 * <strong>Purpose:</strong> Run assembly and recording.
 * <p><strong>Pipeline role:</strong> probe output source &rarr; {@link ca.gc.cra.pathtrace.application.pipeline.RunAssembler}
 * &rarr; run history.
 * <p><strong>Errors:</strong> Probe output failures abort the current run only and are rethrown to the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.application.pipeline;
