package ca.gc.cra.pathtrace.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each PATHTRACE command.
 *
 * <p>Blank values mark optional settings that stay unset unless YAML or the command line provides them.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for the requested command merged with common defaults.
   *
   * @param mode command name (trace, ingest, view)
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "trace" -> buildTraceDefaults();
      case "ingest" -> buildIngestDefaults();
      case "view" -> buildViewDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildTraceDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("store", "");
    map.put("dialect", DialectChoice.AUTO.name().toLowerCase(Locale.ROOT));
    map.put("tries", Integer.toString(TraceConfig.DEFAULT_TRIES));
    map.put("maxHop", Integer.toString(TraceConfig.DEFAULT_MAX_HOP));
    map.put("firstHop", "");
    map.put("gateways", "");
    map.put("icmp", "false");
    map.put("connectionType", ConnectionType.UDP.argument());
    map.put("port", Integer.toString(TraceConfig.DEFAULT_PORT));
    map.put("resolveHostnames", "false");
    map.put("typeOfService", "");
    map.put("wait", Integer.toString(TraceConfig.DEFAULT_WAIT_SECONDS));
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildIngestDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("tries", Integer.toString(TraceConfig.DEFAULT_TRIES));
    map.put("command", "");
    map.put("store", "");
    return map;
  }

  private static Map<String, String> buildViewDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("action", ViewAction.INFO.name().toLowerCase(Locale.ROOT));
    map.put("targets", "");
    map.put("out", "");
    return map;
  }
}
