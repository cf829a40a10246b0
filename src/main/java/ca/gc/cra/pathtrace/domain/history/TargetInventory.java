package ca.gc.cra.pathtrace.domain.history;

import java.util.Objects;

/**
 * Run counts recorded for one target.
 *
 * @param target target name
 * @param runsWithData runs that produced at least one hop
 * @param runsWithoutData runs that produced no hop
 * @since 0.1.0
 */
public record TargetInventory(String target, int runsWithData, int runsWithoutData) {

  public TargetInventory {
    Objects.requireNonNull(target, "target");
  }

  public int totalRuns() {
    return runsWithData + runsWithoutData;
  }
}
