package ca.gc.cra.pathtrace.config;

import ca.gc.cra.pathtrace.validation.Strings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of {@code pathtrace view}.
 *
 * @param store history file to read
 * @param action report to produce
 * @param targets targets to include; empty selects every target in the store
 * @param out file receiving the report instead of standard output
 * @since 0.1.0
 */
public record ViewConfig(Path store, ViewAction action, List<String> targets, Optional<Path> out) {

  public ViewConfig {
    Objects.requireNonNull(store, "store");
    action = Objects.requireNonNullElse(action, ViewAction.INFO);
    targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
    out = Objects.requireNonNullElse(out, Optional.empty());
  }

  /**
   * Creates a configuration from CLI-style key/value pairs.
   *
   * @param options keys {@code store}, {@code action}, {@code targets}, {@code out}
   * @return populated configuration
   * @throws IllegalArgumentException when {@code store} is missing or a value is invalid
   */
  public static ViewConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String store = options.get("store");
    if (TraceConfig.blank(store)) {
      throw new IllegalArgumentException("store must be provided");
    }
    String action = options.get("action");
    return new ViewConfig(
        TraceConfig.parsePath("store", store),
        TraceConfig.blank(action) ? ViewAction.INFO : ViewAction.fromString(action),
        Strings.splitList("targets", options.get("targets")),
        TraceConfig.optionalPath("out", options.get("out")));
  }
}
