package ca.gc.cra.pathtrace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("tries", "3", "maxHop", "64", "wait", "3");
    Map<String, String> yaml = Map.of("tries", "5", "maxHop", "30");
    Map<String, String> cli = Map.of("tries", "1", "target", "example.org");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "trace",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("1", merged.get("tries"));
    assertEquals("30", merged.get("maxHop"));
    assertEquals("3", merged.get("wait"));
    assertEquals("example.org", merged.get("target"));
    assertEquals(List.of("CLI overrides YAML for key: tries"), warnings);
  }

  @Test
  void warnsWhenHostnameResolutionCannotApply() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "trace",
        Optional.empty(),
        Map.of("resolveHostnames", "true", "dialect", "modern"),
        DefaultsForMode.asFlatMap("trace"),
        warnings::add);

    assertEquals(1, warnings.size());
    assertTrue(warnings.get(0).startsWith("resolveHostnames has no effect"));
  }

  @Test
  void warnsWhenIcmpMeetsUdpConnectionType() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "trace", Optional.empty(), Map.of("icmp", "true"), DefaultsForMode.asFlatMap("trace"), warnings::add);

    assertEquals(1, warnings.size());
  }

  @Test
  void nullSourcesAreTreatedAsEmpty() {
    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig("view", Optional.empty(), null, null, null);

    assertTrue(merged.isEmpty());
  }
}
