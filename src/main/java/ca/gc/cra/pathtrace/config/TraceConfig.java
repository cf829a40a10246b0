package ca.gc.cra.pathtrace.config;

import ca.gc.cra.pathtrace.validation.Net;
import ca.gc.cra.pathtrace.validation.Numbers;
import ca.gc.cra.pathtrace.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Configuration of one live probe run ({@code pathtrace trace}).
 * <p><strong>Why:</strong> Consolidates CLI flags, YAML, and defaults into the probe tool options and the
 * history file the run is appended to.</p>
 * <p><strong>Role:</strong> Adapter configuration consumed by {@code TracerouteCommand} and {@code TraceCli}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param target host name or IPv4 address to probe
 * @param store explicit history file; {@link #effectiveStore()} falls back to {@code <target>-output.json}
 * @param dialect fixed output dialect, or {@link DialectChoice#AUTO} to ask the installed tool
 * @param tries probes per hop
 * @param maxHop largest TTL probed
 * @param firstHop initial TTL when not 1
 * @param gateways loose source routing gateways
 * @param icmp whether ICMP ECHO probes are requested ({@code -I})
 * @param connectionType probe method passed as {@code --udp}/{@code --icmp} or {@code -M}
 * @param port destination port
 * @param resolveHostnames ask inetutils traceroute to resolve names (modern traceroute always does)
 * @param typeOfService IP type of service byte
 * @param waitSeconds seconds to wait for each reply
 * @since 0.1.0
 * @see ca.gc.cra.pathtrace.infrastructure.exec.TracerouteCommand
 */
public record TraceConfig(
    String target,
    Optional<Path> store,
    DialectChoice dialect,
    int tries,
    int maxHop,
    Optional<Integer> firstHop,
    List<String> gateways,
    boolean icmp,
    ConnectionType connectionType,
    int port,
    boolean resolveHostnames,
    Optional<Integer> typeOfService,
    int waitSeconds) {

  public static final int DEFAULT_TRIES = 3;
  public static final int DEFAULT_MAX_HOP = 64;
  public static final int DEFAULT_PORT = 33434;
  public static final int DEFAULT_WAIT_SECONDS = 3;
  static final String STORE_SUFFIX = "-output.json";

  public TraceConfig {
    target = Net.validateTarget(target);
    store = Objects.requireNonNullElse(store, Optional.empty());
    dialect = Objects.requireNonNullElse(dialect, DialectChoice.AUTO);
    Numbers.requireRange("tries", tries, 1, 10);
    Numbers.requireRange("maxHop", maxHop, 1, 255);
    firstHop = Objects.requireNonNullElse(firstHop, Optional.empty());
    firstHop.ifPresent(value -> Numbers.requireRange("firstHop", value, 1, maxHop));
    gateways = List.copyOf(Objects.requireNonNull(gateways, "gateways"));
    connectionType = Objects.requireNonNullElse(connectionType, ConnectionType.UDP);
    Numbers.requireRange("port", port, 1, 65_535);
    typeOfService = Objects.requireNonNullElse(typeOfService, Optional.empty());
    typeOfService.ifPresent(value -> Numbers.requireRange("typeOfService", value, 0, 255));
    Numbers.requireRange("wait", waitSeconds, 0, 60);
  }

  /**
   * Returns a configuration probing {@code target} with default options.
   *
   * @param target host name or IPv4 address
   * @return default configuration
   */
  public static TraceConfig defaults(String target) {
    return new TraceConfig(
        target,
        Optional.empty(),
        DialectChoice.AUTO,
        DEFAULT_TRIES,
        DEFAULT_MAX_HOP,
        Optional.empty(),
        List.of(),
        false,
        ConnectionType.UDP,
        DEFAULT_PORT,
        false,
        Optional.empty(),
        DEFAULT_WAIT_SECONDS);
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options keys such as {@code target}, {@code tries}, {@code gateways}; blank values mean "unset"
   * @return populated configuration
   * @throws IllegalArgumentException when a value is invalid or {@code target} is missing
   */
  public static TraceConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String target = options.get("target");
    if (target == null || target.isBlank()) {
      throw new IllegalArgumentException("target must be provided");
    }
    int maxHop = intOption(options, "maxHop", DEFAULT_MAX_HOP, 1, 255);
    List<String> gateways = new ArrayList<>();
    for (String gateway : Strings.splitList("gateways", options.get("gateways"))) {
      gateways.add(Net.validateTarget(gateway));
    }
    return new TraceConfig(
        target,
        optionalPath("store", options.get("store")),
        DialectChoice.fromString(options.get("dialect")),
        intOption(options, "tries", DEFAULT_TRIES, 1, 10),
        maxHop,
        optionalInt(options, "firstHop", 1, 255),
        gateways,
        booleanOption(options, "icmp"),
        blank(options.get("connectionType"))
            ? ConnectionType.UDP
            : ConnectionType.fromString(options.get("connectionType")),
        intOption(options, "port", DEFAULT_PORT, 1, 65_535),
        booleanOption(options, "resolveHostnames"),
        optionalInt(options, "typeOfService", 0, 255),
        intOption(options, "wait", DEFAULT_WAIT_SECONDS, 0, 60));
  }

  /**
   * Resolves the history file the run is appended to.
   *
   * @return configured store, or {@code <target>-output.json} in the working directory
   */
  public Path effectiveStore() {
    return store.orElseGet(() -> Path.of(target + STORE_SUFFIX));
  }

  static int intOption(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    return blank(raw) ? defaultValue : Numbers.parseIntInRange(key, raw, min, max);
  }

  static Optional<Integer> optionalInt(Map<String, String> options, String key, int min, int max) {
    String raw = options.get(key);
    return blank(raw) ? Optional.empty() : Optional.of(Numbers.parseIntInRange(key, raw, min, max));
  }

  static boolean booleanOption(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (blank(raw)) {
      return false;
    }
    String value = raw.trim();
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
  }

  static Optional<Path> optionalPath(String key, String raw) {
    if (blank(raw)) {
      return Optional.empty();
    }
    return Optional.of(parsePath(key, raw));
  }

  static Path parsePath(String key, String raw) {
    String value = Strings.requireNonBlank(key, raw);
    try {
      return Path.of(value);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " must be a valid path (was " + value + ")", ex);
    }
  }

  static boolean blank(String value) {
    return value == null || value.isBlank();
  }
}
