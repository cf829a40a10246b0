package ca.gc.cra.pathtrace.infrastructure.exec;

import ca.gc.cra.pathtrace.config.TraceConfig;
import ca.gc.cra.pathtrace.domain.probe.Dialect;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the {@code traceroute} argument vector for a {@link TraceConfig} and dialect.
 *
 * <p>Option spelling differs between dialects: the probe method is {@code --udp}/{@code --icmp} for
 * modern traceroute and {@code -M udp|icmp} for inetutils, and only inetutils accepts
 * {@code --resolve-hostnames}.</p>
 *
 * @since 0.1.0
 */
public final class TracerouteCommand {
  /** Executable name resolved through {@code PATH}. */
  public static final String EXECUTABLE = "traceroute";

  private final List<String> argv;

  private TracerouteCommand(List<String> argv) {
    this.argv = List.copyOf(argv);
  }

  /**
   * Creates the command for a run.
   *
   * @param config run configuration
   * @param dialect dialect of the installed tool
   * @return command ready to launch
   */
  public static TracerouteCommand of(TraceConfig config, Dialect dialect) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(dialect, "dialect");
    List<String> argv = new ArrayList<>();
    argv.add(EXECUTABLE);
    config.firstHop().ifPresent(first -> {
      argv.add("-f");
      argv.add(Integer.toString(first));
    });
    if (!config.gateways().isEmpty()) {
      argv.add("-g");
      argv.add(String.join(" ", config.gateways()));
    }
    if (config.icmp()) {
      argv.add("-I");
    }
    argv.add("-m");
    argv.add(Integer.toString(config.maxHop()));
    if (dialect == Dialect.INETUTILS) {
      argv.add("-M");
      argv.add(config.connectionType().argument());
    } else {
      argv.add("--" + config.connectionType().argument());
    }
    argv.add("-p");
    argv.add(Integer.toString(config.port()));
    argv.add("-q");
    argv.add(Integer.toString(config.tries()));
    if (dialect == Dialect.INETUTILS && config.resolveHostnames()) {
      argv.add("--resolve-hostnames");
    }
    config.typeOfService().ifPresent(tos -> {
      argv.add("-t");
      argv.add(Integer.toString(tos));
    });
    argv.add("-w");
    argv.add(Integer.toString(config.waitSeconds()));
    argv.add(config.target());
    return new TracerouteCommand(argv);
  }

  /**
   * Returns the argument vector, executable first.
   *
   * @return immutable argv
   */
  public List<String> argv() {
    return argv;
  }

  /**
   * Returns the argv joined by single spaces, as recorded in run histories.
   *
   * @return command text
   */
  public String commandText() {
    return String.join(" ", argv);
  }

  @Override
  public String toString() {
    return commandText();
  }
}
