package ca.gc.cra.pathtrace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void traceDefaultsMatchConfigDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("trace");

    assertEquals("auto", defaults.get("dialect"));
    assertEquals("3", defaults.get("tries"));
    assertEquals("64", defaults.get("maxHop"));
    assertEquals("33434", defaults.get("port"));
    assertEquals("udp", defaults.get("connectionType"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("target"));
  }

  @Test
  void eachModeHasItsOwnKeys() {
    assertEquals("", DefaultsForMode.asFlatMap("ingest").get("command"));
    assertEquals("info", DefaultsForMode.asFlatMap(" View ").get("action"));
    assertFalse(DefaultsForMode.asFlatMap("view").containsKey("tries"));
  }

  @Test
  void defaultsBuildValidTraceConfig() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("trace"));
    options.put("target", "example.org");

    assertEquals(TraceConfig.defaults("example.org"), TraceConfig.fromMap(options));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
