package ca.gc.cra.pathtrace.domain.stats;

import java.util.Objects;
import java.util.Optional;

/**
 * An address seen at a hop index, with the name the probe tool reported for it.
 *
 * @param address responding address, or {@link #UNKNOWN_ADDRESS} when the hop never answered
 * @param hostname reported name when one was seen
 * @since 0.1.0
 */
public record HopHost(String address, Optional<String> hostname) {
  /** Placeholder shown for a hop index at which no run ever recorded an address. */
  public static final String UNKNOWN_ADDRESS = "???";

  public HopHost {
    Objects.requireNonNull(address, "address");
    hostname = Objects.requireNonNullElse(hostname, Optional.empty());
  }

  static HopHost unknown() {
    return new HopHost(UNKNOWN_ADDRESS, Optional.empty());
  }
}
