package ca.gc.cra.pathtrace.application.pipeline;

import ca.gc.cra.pathtrace.application.parse.HopLineParser;
import ca.gc.cra.pathtrace.application.port.ClockPort;
import ca.gc.cra.pathtrace.application.port.ProbeOutputSource;
import ca.gc.cra.pathtrace.domain.probe.HopRecord;
import ca.gc.cra.pathtrace.domain.probe.InvalidProbeArgumentException;
import ca.gc.cra.pathtrace.domain.probe.MalformedHopLineException;
import ca.gc.cra.pathtrace.domain.probe.ProbeOutputException;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import ca.gc.cra.pathtrace.domain.probe.UnresolvedHostException;
import ca.gc.cra.pathtrace.logging.Logs;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads one probe invocation's output and assembles it into a {@link RunResult}.
 * <p><strong>Why:</strong> Separates the line protocol of the probe tool (banner, hop lines, terminating
 * blank line, error banners) from how hop lines are tokenized.</p>
 * <p><strong>Role:</strong> Application service invoked by {@link TraceRunUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stamp the run before the banner is read and time the hop loop.</li>
 *   <li>Fail fast on unresolved targets and rejected arguments.</li>
 *   <li>Require strictly increasing hop indices.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; one source per call.</p>
 *
 * @since 0.1.0
 */
public final class RunAssembler {
  private static final Logger log = LoggerFactory.getLogger(RunAssembler.class);
  private static final String UNRESOLVED_MARKER = "name or service not known";
  private static final String INVALID_ARGUMENT_MARKER = "invalid argument";
  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  private final HopLineParser parser;
  private final ClockPort clock;

  public RunAssembler(HopLineParser parser, ClockPort clock) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Consumes the source until end of stream or the first blank line.
   *
   * @param source probe output; not closed by this method
   * @return assembled run; a run without hops when only a banner was printed
   * @throws UnresolvedHostException if the banner reports an unknown target name
   * @throws InvalidProbeArgumentException if the tool reports an invalid argument
   * @throws MalformedHopLineException if a hop line is malformed or out of order
   * @throws ProbeOutputException for any other probe accounting failure
   * @throws IOException if reading the source fails
   */
  public RunResult assemble(ProbeOutputSource source) throws ProbeOutputException, IOException {
    Objects.requireNonNull(source, "source");
    int expectedTries = source.expectedTries();
    if (expectedTries < 1) {
      throw new IllegalArgumentException("expectedTries must be >= 1");
    }
    Instant timestamp = clock.now();
    String banner = source.banner();
    String description = banner == null ? "" : banner.trim();
    if (lower(description).contains(UNRESOLVED_MARKER)) {
      throw new UnresolvedHostException(source.target(), description);
    }
    log.debug("Probe banner: {}", Logs.probeLine(description));

    long started = clock.monotonicNanos();
    List<HopRecord> hops = new ArrayList<>();
    int previousIndex = -1;
    String line;
    while ((line = source.nextLine()) != null) {
      if (line.isBlank()) {
        break;
      }
      if (lower(line).contains(INVALID_ARGUMENT_MARKER)) {
        throw new InvalidProbeArgumentException(line);
      }
      HopRecord hop = parser.parse(line, source.dialect(), expectedTries);
      if (hop.index() <= previousIndex) {
        throw new MalformedHopLineException(
            "hop index " + hop.index() + " does not follow " + previousIndex, line);
      }
      log.debug("Parsed hop {}: {}", hop.index(), Logs.probeLine(line));
      hops.add(hop);
      previousIndex = hop.index();
    }
    double durationSeconds = Math.max(0, clock.monotonicNanos() - started) / NANOS_PER_SECOND;

    return new RunResult(source.target(), source.command(), description, timestamp, durationSeconds, hops);
  }

  private static String lower(String value) {
    return value.toLowerCase(Locale.ROOT);
  }
}
