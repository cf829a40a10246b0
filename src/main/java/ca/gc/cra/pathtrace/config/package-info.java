/**
 * <strong>Purpose:</strong> Command configuration: typed records per command, YAML loading, defaults,
 * and precedence merging.
 * <p><strong>Precedence:</strong> command line &gt; YAML ({@code common} then command section) &gt;
 * {@link ca.gc.cra.pathtrace.config.DefaultsForMode}.
 * <p><strong>Errors:</strong> Invalid values raise {@link java.lang.IllegalArgumentException} naming the key.
 *
 * @since 0.1.0
 */
package ca.gc.cra.pathtrace.config;
