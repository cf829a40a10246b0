package ca.gc.cra.pathtrace.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and CLI sources, warning about settings that conflict.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged, warn);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective, Consumer<String> warn) {
    if ("trace".equalsIgnoreCase(mode)) {
      boolean icmp = Boolean.parseBoolean(trim(effective.get("icmp")));
      String connectionType = trim(effective.get("connectionType"));
      if (icmp && connectionType.equalsIgnoreCase("udp") && warn != null) {
        warn.accept("icmp=true sends ICMP ECHO probes; connectionType=udp is passed through unchanged");
      }
      if (Boolean.parseBoolean(trim(effective.get("resolveHostnames")))
          && trim(effective.get("dialect")).equalsIgnoreCase("modern")
          && warn != null) {
        warn.accept("resolveHostnames has no effect for the modern dialect; names are always resolved");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
