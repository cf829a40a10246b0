package ca.gc.cra.pathtrace.application.port;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import java.io.IOException;

/**
 * <strong>What:</strong> Port delivering the text output of one probe invocation line by line.
 * <p><strong>Why:</strong> Decouples run assembly from how the output is obtained: a live child process,
 * a captured file, or standard input.</p>
 * <p><strong>Role:</strong> Input port consumed by {@code RunAssembler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Describe the invocation: target, command text, dialect, and probes per hop.</li>
 *   <li>Yield the banner line first, then hop lines until the stream ends.</li>
 *   <li>Release the underlying process or reader on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single consumer; not thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ProbeOutputSource extends AutoCloseable {
  /** Host name or address being probed. */
  String target();

  /** Command text that produced (or would have produced) the output. */
  String command();

  /** Output dialect used to classify tokens. */
  Dialect dialect();

  /** Probes sent per hop; at least one. */
  int expectedTries();

  /**
   * Reads the banner line printed before any hop.
   *
   * @return banner text, or {@code null} if the stream ended immediately
   * @throws IOException if the underlying stream fails
   */
  String banner() throws IOException;

  /**
   * Reads the next output line.
   *
   * @return next line, or {@code null} when the stream is depleted
   * @throws IOException if the underlying stream fails
   */
  String nextLine() throws IOException;

  /**
   * Releases the underlying process or reader.
   *
   * @throws IOException if closing fails
   */
  @Override
  void close() throws IOException;
}
