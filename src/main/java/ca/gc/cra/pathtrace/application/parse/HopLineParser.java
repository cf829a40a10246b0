package ca.gc.cra.pathtrace.application.parse;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import ca.gc.cra.pathtrace.domain.probe.HopRecord;
import ca.gc.cra.pathtrace.domain.probe.MalformedHopLineException;
import ca.gc.cra.pathtrace.domain.probe.ProbeCountMismatchException;
import ca.gc.cra.pathtrace.domain.probe.ProbeToken;
import ca.gc.cra.pathtrace.logging.Logs;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns one raw hop line of probe output into a {@link HopRecord}.
 * <p><strong>Why:</strong> Hop lines are unlabelled whitespace-separated tokens whose meaning depends on the
 * output dialect; every downstream aggregation relies on a strict, accounted-for parse.</p>
 * <p><strong>Role:</strong> Application service used by {@code RunAssembler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read the leading hop index.</li>
 *   <li>Classify each remaining token through the supplied {@link Dialect}.</li>
 *   <li>Drop a resolved name that cannot be attributed to a single address.</li>
 *   <li>Reject lines whose probe outcomes do not add up to the number of probes sent.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class HopLineParser {
  private static final Logger log = LoggerFactory.getLogger(HopLineParser.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern HOP_INDEX = Pattern.compile("\\d{1,9}");

  /**
   * Parses a hop line.
   *
   * @param line raw hop line; leading and trailing whitespace is ignored
   * @param dialect output dialect of the probe tool; must not be {@code null}
   * @param expectedTries probes sent per hop; must be at least one
   * @return parsed hop
   * @throws MalformedHopLineException if the line is blank or does not start with a non-negative integer
   * @throws ProbeCountMismatchException if times plus timeouts differ from {@code expectedTries}
   * @throws IllegalArgumentException if {@code expectedTries} is below one
   */
  public HopRecord parse(String line, Dialect dialect, int expectedTries)
      throws MalformedHopLineException, ProbeCountMismatchException {
    Objects.requireNonNull(dialect, "dialect");
    if (expectedTries < 1) {
      throw new IllegalArgumentException("expectedTries must be >= 1");
    }
    String trimmed = line == null ? "" : line.trim();
    if (trimmed.isEmpty()) {
      throw new MalformedHopLineException("hop line is blank", line);
    }
    String[] tokens = WHITESPACE.split(trimmed);
    if (!HOP_INDEX.matcher(tokens[0]).matches()) {
      throw new MalformedHopLineException("hop line must start with a hop index", line);
    }
    int index = Integer.parseInt(tokens[0]);

    Set<String> addresses = new LinkedHashSet<>();
    List<Double> samples = new ArrayList<>(expectedTries);
    int timeouts = 0;
    String hostname = null;
    for (int i = 1; i < tokens.length; i++) {
      ProbeToken token = dialect.classify(tokens[i]);
      switch (token.kind()) {
        case TIMEOUT -> timeouts++;
        case ADDRESS -> addresses.add(token.value());
        case TIME -> samples.add(token.millis());
        case NAME -> hostname = token.value();
        case IGNORED -> {
          // unit markers and annotations
        }
        default -> throw new IllegalStateException("Unhandled token kind: " + token.kind());
      }
    }

    if (hostname != null && !addresses.isEmpty()) {
      if (addresses.size() > 1) {
        log.debug("Dropping hostname {} shared by {} addresses on hop {}: {}",
            hostname, addresses.size(), index, Logs.probeLine(trimmed));
        hostname = null;
      } else if (addresses.contains(hostname)) {
        hostname = null;
      }
    }
    HopRecord hop = new HopRecord(index, addresses, Optional.ofNullable(hostname), samples, timeouts);
    if (hop.probeCount() != expectedTries) {
      throw new ProbeCountMismatchException(line, expectedTries, hop.probeCount());
    }
    return hop;
  }
}
