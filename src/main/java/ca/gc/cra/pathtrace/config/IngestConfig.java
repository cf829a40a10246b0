package ca.gc.cra.pathtrace.config;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import ca.gc.cra.pathtrace.validation.Net;
import ca.gc.cra.pathtrace.validation.Numbers;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of {@code pathtrace ingest}: replaying captured probe output into a history file.
 *
 * @param input captured output file; empty when reading standard input ({@code in=-})
 * @param target target the output was produced for
 * @param dialect dialect of the captured output; detection is impossible offline so it is required
 * @param tries probes per hop used when the output was captured
 * @param command command text recorded with the run
 * @param store explicit history file
 * @since 0.1.0
 */
public record IngestConfig(
    Optional<Path> input,
    String target,
    Dialect dialect,
    int tries,
    String command,
    Optional<Path> store) {

  /** Value of {@code in} selecting standard input. */
  public static final String STDIN = "-";

  public IngestConfig {
    input = Objects.requireNonNullElse(input, Optional.empty());
    target = Net.validateTarget(target);
    Objects.requireNonNull(dialect, "dialect");
    Numbers.requireRange("tries", tries, 1, 10);
    command = command == null || command.isBlank() ? defaultCommand(target, tries) : command.trim();
    store = Objects.requireNonNullElse(store, Optional.empty());
    if (input.isPresent() && sameFile(input.get(), storeFor(target, store))) {
      throw new IllegalArgumentException("store must differ from in (" + input.get() + ")");
    }
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options keys {@code in}, {@code target}, {@code dialect}, {@code tries}, {@code command}, {@code store}
   * @return populated configuration
   * @throws IllegalArgumentException when a required key is missing or a value is invalid
   */
  public static IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = options.get("in");
    if (TraceConfig.blank(in)) {
      throw new IllegalArgumentException("in must be provided (file path or -)");
    }
    String target = options.get("target");
    if (TraceConfig.blank(target)) {
      throw new IllegalArgumentException("target must be provided");
    }
    String dialect = options.get("dialect");
    if (TraceConfig.blank(dialect) || dialect.trim().equalsIgnoreCase("auto")) {
      throw new IllegalArgumentException("dialect must be modern or inetutils for ingest");
    }
    Optional<Path> input = in.trim().equals(STDIN)
        ? Optional.empty()
        : Optional.of(TraceConfig.parsePath("in", in));
    return new IngestConfig(
        input,
        target,
        Dialect.fromName(dialect),
        TraceConfig.intOption(options, "tries", TraceConfig.DEFAULT_TRIES, 1, 10),
        options.get("command"),
        TraceConfig.optionalPath("store", options.get("store")));
  }

  public Path effectiveStore() {
    return storeFor(target, store);
  }

  private static Path storeFor(String target, Optional<Path> store) {
    return store.orElseGet(() -> Path.of(target + TraceConfig.STORE_SUFFIX));
  }

  private static boolean sameFile(Path first, Path second) {
    return first.toAbsolutePath().normalize().equals(second.toAbsolutePath().normalize());
  }

  private static String defaultCommand(String target, int tries) {
    return "traceroute -q " + tries + " " + target;
  }
}
