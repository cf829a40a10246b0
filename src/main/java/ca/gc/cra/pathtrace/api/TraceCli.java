package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.application.pipeline.TraceRunUseCase;
import ca.gc.cra.pathtrace.config.CompositionRoot;
import ca.gc.cra.pathtrace.config.TraceConfig;
import ca.gc.cra.pathtrace.domain.probe.Dialect;
import ca.gc.cra.pathtrace.domain.probe.ProbeOutputException;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import ca.gc.cra.pathtrace.infrastructure.exec.ProcessProbeOutputSource;
import ca.gc.cra.pathtrace.infrastructure.exec.TracerouteCommand;
import ca.gc.cra.pathtrace.infrastructure.exec.TracerouteVersionDetector;
import ca.gc.cra.pathtrace.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.pathtrace.logging.LoggingConfigurator;
import ca.gc.cra.pathtrace.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for probing a target with the installed {@code traceroute} and recording the run.
 *
 * @since 0.1.0
 */
public final class TraceCli {
  private static final Logger log = LoggerFactory.getLogger(TraceCli.class);
  private static final String SUMMARY_USAGE =
      "usage: trace target=HOST [store=FILE] [dialect=auto|modern|inetutils] [tries=3] [maxHop=64] "
          + "[firstHop=N] [gateways=A,B] [icmp=true|false] [connectionType=udp|icmp] [port=33434] "
          + "[resolveHostnames=true|false] [typeOfService=N] [wait=3] [config=FILE] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      PATHTRACE trace

      Usage:
        trace target=example.org [options]

      Required:
        target=HOST              Host name or IPv4 address to probe

      Optional (validated):
        store=FILE               History file (default <target>-output.json)
        dialect=auto|modern|inetutils
                                 Output format of the installed traceroute (default auto: ask --version)
        tries=N                  Probes per hop, 1-10 (default 3)
        maxHop=N                 Largest TTL, 1-255 (default 64)
        firstHop=N               Initial TTL, at most maxHop
        gateways=A,B             Loose source route gateways
        icmp=true|false          Use ICMP ECHO probes (-I)
        connectionType=udp|icmp  Probe method (default udp)
        port=N                   Destination port (default 33434)
        resolveHostnames=true    Ask inetutils traceroute to resolve names
        typeOfService=N          IP TOS byte, 0-255
        wait=N                   Seconds to wait per reply, 0-60 (default 3)
        config=FILE              YAML file with common/trace sections
        --dry-run                Print the command without running it
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Notes:
        - A failed or unparseable run leaves the history file untouched.
      """;

  private TraceCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the trace command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, new TracerouteVersionDetector());
  }

  static ExitCode run(String[] args, TracerouteVersionDetector detector) {
    CommandLine commandLine = CommandLine.parse(args);
    if (commandLine.help()) {
      Console.help(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (commandLine.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    try {
      kv = commandLine.options();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      Console.line(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig("trace", kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid trace configuration: {}", ex.getMessage());
      Console.line(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (!commandLine.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    boolean dryRun = commandLine.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    TraceConfig config;
    Path store;
    String metricsExporter;
    try {
      metricsExporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = TraceConfig.fromMap(configInputs);
      store = dryRun
          ? Paths.validatePath(config.effectiveStore())
          : Paths.validateWritableFile(config.effectiveStore(), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid trace arguments: {}", ex.getMessage());
      Console.line(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Dialect dialect;
    try {
      Optional<Dialect> fixed = config.dialect().fixed();
      dialect = fixed.isPresent() ? fixed.get() : detector.detect();
    } catch (IllegalArgumentException ex) {
      log.error("Unsupported traceroute: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to determine the traceroute version; set dialect=modern|inetutils", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while detecting the traceroute version", ex);
      return ExitCode.INTERRUPTED;
    }

    TracerouteCommand command = TracerouteCommand.of(config, dialect);
    if (dryRun) {
      printDryRunPlan(config, dialect, command, store);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      log.info("Configured trace: target={}, dialect={}, store={}, metricsExporter={}",
          config.target(), dialect, store, metricsExporter);
      TraceRunUseCase useCase = new CompositionRoot(metrics).traceRunUseCase(store);
      RunResult run = useCase.run(
          ProcessProbeOutputSource.start(command, config.target(), dialect, config.tries()));
      Console.line(describe(run, store));
      return ExitCode.SUCCESS;
    } catch (ProbeOutputException | IOException | RuntimeException ex) {
      ExitCode exit = ExitCode.forFailure(ex);
      if (exit == ExitCode.PROBE_FAILURE) {
        log.error("Probe of {} failed: {}", config.target(), ex.getMessage());
      } else {
        log.error("Trace of {} into {} ended with {}", config.target(), store, exit, ex);
      }
      return exit;
    }
  }

  static String describe(RunResult run, Path store) {
    return run.hasData()
        ? "Recorded " + run.hops().size() + " hops to " + run.target() + " in " + store
        : "Recorded run to " + run.target() + " without data in " + store;
  }

  private static void printDryRunPlan(TraceConfig config, Dialect dialect, TracerouteCommand command, Path store) {
    Console.lines(
        "Trace dry-run: traceroute will not be launched.",
        " Target            : " + config.target(),
        " Dialect           : " + dialect.name().toLowerCase(Locale.ROOT),
        " Probes per hop    : " + config.tries(),
        " History file      : " + store,
        " Command           : " + command.commandText(),
        " Re-run without --dry-run to probe the target.");
  }
}
