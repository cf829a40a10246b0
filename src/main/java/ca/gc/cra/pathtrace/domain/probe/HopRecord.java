package ca.gc.cra.pathtrace.domain.probe;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> One hop (TTL distance) of a single traceroute run.
 * <p><strong>Why:</strong> Normalizes a free-form hop line into the values every aggregation needs:
 * responding addresses, an optional resolved name, and per-probe latencies.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; collections are unmodifiable copies.</p>
 *
 * @param index hop index as printed by the probe tool (equal to the TTL)
 * @param addresses distinct responding addresses in first-seen order; may be empty when every probe timed out
 * @param hostname name reported by the probe tool, present only when it unambiguously belongs to the sole address
 * @param samples round-trip times in milliseconds, in probe order
 * @param timeouts number of probes answered with {@code *}
 * @since 0.1.0
 */
public record HopRecord(
    int index,
    Set<String> addresses,
    Optional<String> hostname,
    List<Double> samples,
    int timeouts) {

  public HopRecord {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    if (timeouts < 0) {
      throw new IllegalArgumentException("timeouts must be >= 0");
    }
    addresses = Collections.unmodifiableSet(
        new LinkedHashSet<>(Objects.requireNonNull(addresses, "addresses")));
    hostname = Objects.requireNonNullElse(hostname, Optional.empty());
    samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
  }

  /**
   * Returns the number of probes accounted for on this hop.
   *
   * @return samples plus timeouts
   */
  public int probeCount() {
    return samples.size() + timeouts;
  }

  /**
   * Returns the only responding address when exactly one answered.
   *
   * @return sole address, or empty when none or several responded
   */
  public Optional<String> soleAddress() {
    return addresses.size() == 1 ? Optional.of(addresses.iterator().next()) : Optional.empty();
  }
}
