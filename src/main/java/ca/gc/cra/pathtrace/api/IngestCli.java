package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.application.port.ProbeOutputSource;
import ca.gc.cra.pathtrace.config.CompositionRoot;
import ca.gc.cra.pathtrace.config.IngestConfig;
import ca.gc.cra.pathtrace.domain.probe.ProbeOutputException;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import ca.gc.cra.pathtrace.infrastructure.io.ReaderProbeOutputSource;
import ca.gc.cra.pathtrace.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.pathtrace.logging.LoggingConfigurator;
import ca.gc.cra.pathtrace.validation.Paths;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for recording traceroute output captured earlier (a file, or standard input with {@code in=-}).
 *
 * @since 0.1.0
 */
public final class IngestCli {
  private static final Logger log = LoggerFactory.getLogger(IngestCli.class);
  private static final String SUMMARY_USAGE =
      "usage: ingest in=FILE|- target=HOST dialect=modern|inetutils [tries=3] [command=TEXT] "
          + "[store=FILE] [config=FILE] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      PATHTRACE ingest

      Usage:
        ingest in=./capture.txt target=example.org dialect=modern [options]

      Required:
        in=FILE|-                Captured traceroute output; - reads standard input
        target=HOST              Target the output was produced for
        dialect=modern|inetutils Format of the captured output

      Optional (validated):
        tries=N                  Probes per hop used for the capture, 1-10 (default 3)
        command=TEXT             Command recorded with the run (default traceroute -q <tries> <target>)
        store=FILE               History file (default <target>-output.json); must differ from in
        config=FILE              YAML file with common/ingest sections
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private IngestCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, System.in);
  }

  /**
   * Executes the ingest command.
   *
   * @param args raw CLI arguments
   * @param stdin stream read when {@code in=-}; left open
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args, InputStream stdin) {
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
      effective = ConfigCliUtils.effectiveConfig("ingest", kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ingest configuration: {}", ex.getMessage());
      Console.line(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    IngestConfig config;
    Optional<Path> source;
    Path store;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = IngestConfig.fromMap(configInputs);
      source = config.input().map(Paths::validateReadableFile);
      store = Paths.validateWritableFile(config.effectiveStore(), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid ingest arguments: {}", ex.getMessage());
      Console.line(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      log.info("Ingesting {} output for {} from {} into {}",
          config.dialect(), config.target(), source.map(Path::toString).orElse("<stdin>"), store);
      RunResult run = new CompositionRoot(metrics).traceRunUseCase(store).run(open(config, source, stdin));
      Console.line(TraceCli.describe(run, store));
      return ExitCode.SUCCESS;
    } catch (ProbeOutputException | IOException | RuntimeException ex) {
      ExitCode exit = ExitCode.forFailure(ex);
      if (exit == ExitCode.PROBE_FAILURE) {
        log.error("Captured output for {} is not usable: {}", config.target(), ex.getMessage());
      } else {
        log.error("Ingest of {} into {} ended with {}", config.target(), store, exit, ex);
      }
      return exit;
    }
  }

  private static ProbeOutputSource open(IngestConfig config, Optional<Path> source, InputStream stdin)
      throws IOException {
    if (source.isPresent()) {
      return ReaderProbeOutputSource.open(
          source.get(), config.target(), config.command(), config.dialect(), config.tries());
    }
    return ReaderProbeOutputSource.ofStream(
        stdin, config.target(), config.command(), config.dialect(), config.tries());
  }
}
