package ca.gc.cra.pathtrace.infrastructure.exec;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import ca.gc.cra.pathtrace.domain.probe.UnknownDialectException;
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
 * Determines the dialect of the installed probe tool from the first line of {@code traceroute --version}.
 *
 * @since 0.1.0
 */
public final class TracerouteVersionDetector {
  private static final Logger log = LoggerFactory.getLogger(TracerouteVersionDetector.class);
  private static final long TIMEOUT_SECONDS = 5;

  private final List<String> argv;

  public TracerouteVersionDetector() {
    this(List.of(TracerouteCommand.EXECUTABLE, "--version"));
  }

  TracerouteVersionDetector(List<String> argv) {
    this.argv = List.copyOf(Objects.requireNonNull(argv, "argv"));
  }

  /**
   * Runs the version command and maps its banner.
   *
   * @return detected dialect
   * @throws IOException if the tool cannot be launched (for example, it is not installed)
   * @throws UnknownDialectException if the banner names an unsupported tool or version
   * @throws InterruptedException if interrupted while waiting for the tool to exit
   */
  public Dialect detect() throws IOException, InterruptedException {
    Process process = new ProcessBuilder(argv).redirectErrorStream(true).start();
    String banner;
    try (BufferedReader reader = new BufferedReader(
        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      banner = reader.readLine();
    } finally {
      if (!process.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        process.destroyForcibly();
      }
    }
    Dialect dialect = Dialect.fromVersionBanner(banner);
    log.debug("Detected {} dialect from banner '{}'", dialect, banner);
    return dialect;
  }
}
