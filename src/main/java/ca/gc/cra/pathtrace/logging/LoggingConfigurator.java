package ca.gc.cra.pathtrace.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Switches PATHTRACE loggers to DEBUG for {@code --verbose} or {@code verbose: true}.
 * <p>Only the {@code ca.gc.cra.pathtrace} hierarchy is raised: per-hop parse decisions and JSON store
 * activity become visible while OpenTelemetry and other libraries keep the levels from
 * {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  /** Logger hierarchy raised by {@link #enableVerboseLogging()}. */
  public static final String PATHTRACE_LOGGERS = "ca.gc.cra.pathtrace";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {}

  /**
   * Raises the PATHTRACE loggers to DEBUG.
   *
   * @return {@code false} when the SLF4J backend is not Logback and nothing changed
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: logging backend {} is not Logback", factory.getClass().getName());
      return false;
    }
    Logger pathtrace = context.getLogger(PATHTRACE_LOGGERS);
    pathtrace.setLevel(Level.DEBUG);
    log.debug("PATHTRACE loggers set to DEBUG");
    return true;
  }
}
