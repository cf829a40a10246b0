package ca.gc.cra.pathtrace.infrastructure.exec;

import ca.gc.cra.pathtrace.application.port.ProbeOutputSource;
import ca.gc.cra.pathtrace.domain.probe.Dialect;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ProbeOutputSource} reading a live probe tool child process.
 * <p><strong>Behaviour:</strong> stderr is merged into stdout so error banners arrive in order; lines are
 * decoded as UTF-8 and trimmed.</p>
 * <p><strong>Thread-safety:</strong> Single consumer.</p>
 *
 * @since 0.1.0
 */
public final class ProcessProbeOutputSource implements ProbeOutputSource {
  private static final Logger log = LoggerFactory.getLogger(ProcessProbeOutputSource.class);
  private static final long EXIT_GRACE_MILLIS = 500;

  private final String target;
  private final String command;
  private final Dialect dialect;
  private final int expectedTries;
  private final Process process;
  private final BufferedReader reader;
  private boolean bannerRead;

  ProcessProbeOutputSource(
      String target, String command, Dialect dialect, int expectedTries, Process process) {
    this.target = Objects.requireNonNull(target, "target");
    this.command = Objects.requireNonNull(command, "command");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.expectedTries = expectedTries;
    this.process = Objects.requireNonNull(process, "process");
    this.reader = new BufferedReader(
        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
  }

  /**
   * Launches the command.
   *
   * @param command argv and command text
   * @param target probed target
   * @param dialect dialect of the installed tool
   * @param expectedTries probes per hop passed with {@code -q}
   * @return source reading the child's output
   * @throws IOException if the process cannot be started
   */
  public static ProcessProbeOutputSource start(
      TracerouteCommand command, String target, Dialect dialect, int expectedTries) throws IOException {
    return start(command.argv(), command.commandText(), target, dialect, expectedTries);
  }

  static ProcessProbeOutputSource start(
      List<String> argv, String commandText, String target, Dialect dialect, int expectedTries)
      throws IOException {
    log.info("Launching '{}'", commandText);
    Process process = new ProcessBuilder(argv).redirectErrorStream(true).start();
    return new ProcessProbeOutputSource(target, commandText, dialect, expectedTries, process);
  }

  @Override
  public String target() {
    return target;
  }

  @Override
  public String command() {
    return command;
  }

  @Override
  public Dialect dialect() {
    return dialect;
  }

  @Override
  public int expectedTries() {
    return expectedTries;
  }

  @Override
  public String banner() throws IOException {
    if (bannerRead) {
      throw new IllegalStateException("banner already consumed");
    }
    bannerRead = true;
    return readTrimmed();
  }

  @Override
  public String nextLine() throws IOException {
    bannerRead = true;
    return readTrimmed();
  }

  private String readTrimmed() throws IOException {
    String line = reader.readLine();
    return line == null ? null : line.trim();
  }

  /**
   * Closes the output stream and terminates the child if it is still running.
   *
   * @throws IOException if closing the stream fails
   */
  @Override
  public void close() throws IOException {
    try {
      reader.close();
    } finally {
      terminate();
    }
  }

  private void terminate() {
    if (!process.isAlive()) {
      log.debug("Probe process exited with status {}", process.exitValue());
      return;
    }
    process.destroy();
    try {
      if (!process.waitFor(EXIT_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
        log.warn("Probe process did not exit after {} ms; forcing termination", EXIT_GRACE_MILLIS);
        process.destroyForcibly();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
    }
  }
}
