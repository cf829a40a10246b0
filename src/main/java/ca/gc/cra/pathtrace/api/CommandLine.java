package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.validation.Strings;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Arguments of one {@code trace}, {@code ingest} or {@code view} invocation.
 * <p><strong>Why:</strong> Every command takes {@code key=value} options plus a handful of switches; help
 * must still work when an option is malformed, so options are only checked when {@link #options()} is
 * called.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
final class CommandLine {
  private static final Pattern OPTION_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");

  /** Switches recognised by the commands; any other {@code -x} token is reported as a bad option. */
  enum Switch {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v"),
    DRY_RUN("--dry-run");

    private final Set<String> spellings;

    Switch(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Optional<Switch> lookup(String token) {
      if (token == null) {
        return Optional.empty();
      }
      String normalized = token.trim().toLowerCase(Locale.ROOT);
      for (Switch candidate : values()) {
        if (candidate.spellings.contains(normalized)) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }
  }

  private final List<String> assignments;
  private final Set<Switch> switches;

  private CommandLine(List<String> assignments, Set<Switch> switches) {
    this.assignments = List.copyOf(assignments);
    this.switches = switches.isEmpty() ? Set.of() : Set.copyOf(switches);
  }

  /**
   * Splits raw arguments into switches and option assignments; blank tokens are dropped.
   *
   * @param args raw arguments, possibly {@code null}
   * @return parsed command line
   */
  static CommandLine parse(String[] args) {
    List<String> assignments = new ArrayList<>();
    Set<Switch> switches = EnumSet.noneOf(Switch.class);
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        Optional<Switch> option = Switch.lookup(raw);
        if (option.isPresent()) {
          switches.add(option.get());
        } else {
          assignments.add(raw.trim());
        }
      }
    }
    return new CommandLine(assignments, switches);
  }

  boolean help() {
    return switches.contains(Switch.HELP);
  }

  boolean verbose() {
    return switches.contains(Switch.VERBOSE);
  }

  boolean dryRun() {
    return switches.contains(Switch.DRY_RUN);
  }

  /**
   * Returns the options keyed by name, split on the first {@code '='}; a repeated name keeps its last value.
   *
   * @return mutable map in argument order
   * @throws IllegalArgumentException for an unknown switch, a token without a name or value, or a value
   *     carrying control characters
   */
  Map<String, String> options() {
    Map<String, String> options = new LinkedHashMap<>();
    for (String assignment : assignments) {
      int split = assignment.indexOf('=');
      if (split < 0 && assignment.startsWith("-") && assignment.length() > 1) {
        throw new IllegalArgumentException("unknown switch " + assignment);
      }
      if (split <= 0) {
        throw new IllegalArgumentException("expected name=value but got '" + assignment + "'");
      }
      String name = assignment.substring(0, split).trim();
      if (!OPTION_NAME.matcher(name).matches()) {
        throw new IllegalArgumentException("invalid option name '" + name + "'");
      }
      options.put(name, Strings.requireNonBlank(name, assignment.substring(split + 1)));
    }
    return options;
  }
}
