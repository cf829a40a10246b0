package ca.gc.cra.pathtrace.api;

import ca.gc.cra.pathtrace.config.ConfigMerger;
import ca.gc.cra.pathtrace.config.DefaultsForMode;
import ca.gc.cra.pathtrace.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  /**
   * Loads the optional YAML file named by {@code config=} and merges it with defaults and CLI values.
   *
   * @param mode command name
   * @param kv CLI key/value pairs; the {@code config} entry is removed
   * @param log logger of the calling command, used for override warnings
   * @return effective configuration
   * @throws IllegalArgumentException when the YAML file is missing or invalid or the merge fails validation
   * @throws IOException when the YAML file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> kv, Logger log)
      throws IOException {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }
}
