/**
 * CLI entry points for the trace, ingest and view commands.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and
 * telemetry, and invokes use cases.</p>
 * <p><strong>Errors:</strong> Failures are logged at ERROR and mapped onto {@link ca.gc.cra.pathtrace.api.ExitCode}.</p>
 * <p><strong>Output:</strong> Reports and usage text go to standard output through {@code Console};
 * diagnostics go through SLF4J.</p>
 */
package ca.gc.cra.pathtrace.api;
