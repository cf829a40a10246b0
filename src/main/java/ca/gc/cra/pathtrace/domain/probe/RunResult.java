package ca.gc.cra.pathtrace.domain.probe;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One completed invocation of the probe tool against one target.
 * <p><strong>Why:</strong> The unit appended to run histories and consumed by statistics and topology
 * reconstruction.</p>
 * <p><strong>Role:</strong> Immutable domain value produced by the run assembler or decoded from a
 * persisted history.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @param target host name or address the probe was aimed at
 * @param command command text that produced the output
 * @param description banner line printed by the probe tool
 * @param timestamp wall-clock instant captured before the banner was read
 * @param durationSeconds time spent reading hop lines
 * @param hops hops in strictly increasing index order; empty for a run that produced no data
 * @since 0.1.0
 */
public record RunResult(
    String target,
    String command,
    String description,
    Instant timestamp,
    double durationSeconds,
    List<HopRecord> hops) {

  public RunResult {
    Objects.requireNonNull(target, "target");
    command = Objects.requireNonNullElse(command, "");
    description = Objects.requireNonNullElse(description, "");
    Objects.requireNonNull(timestamp, "timestamp");
    if (durationSeconds < 0 || Double.isNaN(durationSeconds)) {
      throw new IllegalArgumentException("durationSeconds must be >= 0");
    }
    hops = List.copyOf(Objects.requireNonNull(hops, "hops"));
    int previous = -1;
    for (HopRecord hop : hops) {
      if (hop.index() <= previous) {
        throw new IllegalArgumentException(
            "hop indices must be strictly increasing (" + hop.index() + " after " + previous + ")");
      }
      previous = hop.index();
    }
  }

  /**
   * Indicates whether the run recorded any hop.
   *
   * @return {@code true} when at least one hop was parsed
   */
  public boolean hasData() {
    return !hops.isEmpty();
  }
}
