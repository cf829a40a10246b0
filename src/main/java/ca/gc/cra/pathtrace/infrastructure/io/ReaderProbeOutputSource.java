package ca.gc.cra.pathtrace.infrastructure.io;

import ca.gc.cra.pathtrace.application.port.ProbeOutputSource;
import ca.gc.cra.pathtrace.domain.probe.Dialect;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link ProbeOutputSource} replaying previously captured probe output from a {@link Reader}.
 *
 * <p>Lines are trimmed exactly like live output so both paths assemble identical runs.</p>
 *
 * @since 0.1.0
 */
public final class ReaderProbeOutputSource implements ProbeOutputSource {
  private final String target;
  private final String command;
  private final Dialect dialect;
  private final int expectedTries;
  private final BufferedReader reader;
  private final boolean closeReader;

  /**
   * Wraps a reader.
   *
   * @param reader captured output; closed by {@link #close()} when {@code closeReader} is set
   * @param closeReader whether closing this source closes the reader (false for standard input)
   * @param target probed target
   * @param command command text recorded with the run
   * @param dialect dialect of the captured output
   * @param expectedTries probes per hop
   */
  public ReaderProbeOutputSource(
      Reader reader, boolean closeReader, String target, String command, Dialect dialect, int expectedTries) {
    Objects.requireNonNull(reader, "reader");
    this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    this.closeReader = closeReader;
    this.target = Objects.requireNonNull(target, "target");
    this.command = Objects.requireNonNull(command, "command");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.expectedTries = expectedTries;
  }

  /**
   * Opens a captured output file as UTF-8.
   *
   * @throws IOException if the file cannot be opened
   */
  public static ReaderProbeOutputSource open(
      Path file, String target, String command, Dialect dialect, int expectedTries) throws IOException {
    return new ReaderProbeOutputSource(
        Files.newBufferedReader(file, StandardCharsets.UTF_8), true, target, command, dialect, expectedTries);
  }

  /**
   * Reads captured output from a stream that stays open afterwards, such as standard input.
   */
  public static ReaderProbeOutputSource ofStream(
      InputStream in, String target, String command, Dialect dialect, int expectedTries) {
    return new ReaderProbeOutputSource(
        new InputStreamReader(in, StandardCharsets.UTF_8), false, target, command, dialect, expectedTries);
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
    return nextLine();
  }

  @Override
  public String nextLine() throws IOException {
    String line = reader.readLine();
    return line == null ? null : line.trim();
  }

  @Override
  public void close() throws IOException {
    if (closeReader) {
      reader.close();
    }
  }
}
