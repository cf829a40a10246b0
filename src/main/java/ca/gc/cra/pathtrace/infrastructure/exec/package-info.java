/**
 * <strong>Purpose:</strong> Launching the probe tool: command construction, version detection, and the
 * child process output source.
 * <p><strong>Concurrency:</strong> One child process per source; reads block on the child's stdout.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.infrastructure.exec;
