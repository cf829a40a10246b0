package ca.gc.cra.pathtrace.domain.stats;

import java.util.Collection;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Summary of a set of round-trip time samples.
 * <p><strong>Why:</strong> Shared shape for per-hop, per-target, and overall latency figures.</p>
 * <p><strong>Rules:</strong> an empty sample set has every value absent; the standard deviation is the
 * sample deviation (divisor {@code n - 1}) and is absent below two samples.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param count number of samples
 * @param mean arithmetic mean in milliseconds
 * @param min smallest sample
 * @param max largest sample
 * @param stdev sample standard deviation
 * @since 0.1.0
 */
public record AggregateStats(
    int count,
    OptionalDouble mean,
    OptionalDouble min,
    OptionalDouble max,
    OptionalDouble stdev) {

  private static final AggregateStats EMPTY = new AggregateStats(
      0, OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty(), OptionalDouble.empty());

  public AggregateStats {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0");
    }
    Objects.requireNonNull(mean, "mean");
    Objects.requireNonNull(min, "min");
    Objects.requireNonNull(max, "max");
    Objects.requireNonNull(stdev, "stdev");
  }

  /**
   * Returns the statistics of an empty sample set.
   *
   * @return shared empty instance
   */
  public static AggregateStats empty() {
    return EMPTY;
  }

  /**
   * Computes statistics over the given samples.
   *
   * @param samples latencies in milliseconds; must not be {@code null}
   * @return computed statistics; {@link #empty()} when {@code samples} is empty
   */
  public static AggregateStats of(Collection<Double> samples) {
    Objects.requireNonNull(samples, "samples");
    int n = samples.size();
    if (n == 0) {
      return EMPTY;
    }
    double sum = 0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double sample : samples) {
      sum += sample;
      min = Math.min(min, sample);
      max = Math.max(max, sample);
    }
    double mean = sum / n;
    OptionalDouble stdev = OptionalDouble.empty();
    if (n >= 2) {
      double squares = 0;
      for (double sample : samples) {
        double delta = sample - mean;
        squares += delta * delta;
      }
      stdev = OptionalDouble.of(Math.sqrt(squares / (n - 1)));
    }
    return new AggregateStats(
        n, OptionalDouble.of(mean), OptionalDouble.of(min), OptionalDouble.of(max), stdev);
  }

  public boolean isEmpty() {
    return count == 0;
  }
}
