package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.application.analysis.StatsAggregator;
import ca.gc.cra.pathtrace.config.CompositionRoot;
import ca.gc.cra.pathtrace.config.ViewConfig;
import ca.gc.cra.pathtrace.domain.history.RunStore;
import ca.gc.cra.pathtrace.domain.stats.TargetSummary;
import ca.gc.cra.pathtrace.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.pathtrace.infrastructure.render.DotGraphWriter;
import ca.gc.cra.pathtrace.infrastructure.render.StatsTableWriter;
import ca.gc.cra.pathtrace.logging.LoggingConfigurator;
import ca.gc.cra.pathtrace.validation.Paths;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for reporting on a history file.
 *
 * @since 0.1.0
 */
public final class ViewCli {
  private static final Logger log = LoggerFactory.getLogger(ViewCli.class);
  private static final String SUMMARY_USAGE =
      "usage: view store=FILE [action=info|hostnames|stats|table|map] [targets=A,B] [out=FILE] [config=FILE]";
  private static final String HELP_TEXT = """
      PATHTRACE view

      Usage:
        view store=./example.org-output.json action=stats [options]

      Required:
        store=FILE               History file written by trace or ingest

      Optional (validated):
        action=ACTION            info (default)  run counts for the whole file
                                 hostnames       run counts per target
                                 stats           summary statistics (per target when targets= is set)
                                 table           one summary row per target; per-hop tables when targets= is set
                                 map             Graphviz DOT topology of the selected targets
        targets=A,B              Restrict the report to these targets
        out=FILE                 Write the report to FILE instead of standard output
        config=FILE              YAML file with common/view sections
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private ViewCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the view command.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
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

    ViewConfig config;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(ConfigCliUtils.effectiveConfig("view", kv, log));
      TelemetryConfigurator.configureMetrics(configInputs);
      config = ViewConfig.fromMap(configInputs);
      Paths.validateReadableFile(config.store());
      config.out().ifPresent(out -> Paths.validateWritableFile(out, false));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid view arguments: {}", ex.getMessage());
      Console.line(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    CompositionRoot root = new CompositionRoot(new NoOpMetricsAdapter());
    try {
      RunStore store = root.runHistory(config.store()).load();
      log.debug("Loaded {} runs for {} targets from {}", store.size(), store.targets().size(), config.store());
      if (config.out().isPresent()) {
        try (PrintWriter out = new PrintWriter(
            Files.newBufferedWriter(config.out().get(), StandardCharsets.UTF_8))) {
          render(root, config, store, out);
        }
        log.info("Wrote {} report to {}", config.action(), config.out().get());
      } else {
        render(root, config, store, Console.out());
      }
      return ExitCode.SUCCESS;
    } catch (IOException | RuntimeException ex) {
      ExitCode exit = ExitCode.forFailure(ex);
      log.error("{} report on {} ended with {}", config.action(), config.store(), exit, ex);
      return exit;
    }
  }

  private static void render(CompositionRoot root, ViewConfig config, RunStore store, PrintWriter out) {
    StatsTableWriter tables = new StatsTableWriter(out);
    List<String> targets = selectTargets(config.targets(), store);
    switch (config.action()) {
      case INFO -> tables.writeInfo(store.inventory());
      case HOSTNAMES -> tables.writeInventory(store.inventory());
      case STATS -> {
        StatsAggregator aggregator = root.statsAggregator(store);
        if (config.targets().isEmpty()) {
          tables.writeOverall(aggregator.overall());
        } else {
          List<TargetSummary> selected = new ArrayList<>();
          for (TargetSummary summary : aggregator.statsForAll()) {
            if (targets.contains(summary.target())) {
              selected.add(summary);
            }
          }
          tables.writeSummaries(selected);
        }
      }
      case TABLE -> {
        StatsAggregator aggregator = root.statsAggregator(store);
        if (config.targets().isEmpty()) {
          tables.writeSummaries(aggregator.statsForAll());
          return;
        }
        for (String target : targets) {
          tables.writeTargetStats(aggregator.statsFor(target));
          out.println();
        }
        out.flush();
      }
      case MAP -> new DotGraphWriter(out).write(root.topologyBuilder(store).buildGraph(targets));
    }
  }

  private static List<String> selectTargets(List<String> requested, RunStore store) {
    if (requested.isEmpty()) {
      return store.targets();
    }
    List<String> known = new ArrayList<>();
    for (String target : requested) {
      if (store.history(target).isEmpty()) {
        log.warn("Target {} is not in the history file", target);
      } else {
        known.add(target);
      }
    }
    return known;
  }
}
