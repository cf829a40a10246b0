package ca.gc.cra.pathtrace.infrastructure.persistence;

import static ca.gc.cra.pathtrace.testutil.ProbeFixtures.emptyRun;
import static ca.gc.cra.pathtrace.testutil.ProbeFixtures.hop;
import static ca.gc.cra.pathtrace.testutil.ProbeFixtures.run;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pathtrace.domain.history.RunStore;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonRunHistoryAdapterTest {
  @TempDir Path tempDir;

  @Test
  void missingFileLoadsAsEmptyStore() throws IOException {
    JsonRunHistoryAdapter adapter = new JsonRunHistoryAdapter(tempDir.resolve("none.json"));

    assertTrue(adapter.load().isEmpty());
  }

  @Test
  void emptyFileLoadsAsEmptyStore() throws IOException {
    Path file = Files.writeString(tempDir.resolve("blank.json"), "");

    assertTrue(new JsonRunHistoryAdapter(file).load().isEmpty());
  }

  @Test
  void appendedRunsLoadBackInOrder() throws IOException {
    Path file = tempDir.resolve("history.json");
    JsonRunHistoryAdapter adapter = new JsonRunHistoryAdapter(file);
    RunResult first = run("example.org", hop(1, "192.0.2.1", 0.5, 0.6, 0.7));
    RunResult second = emptyRun("example.org");
    RunResult other = run("example.net", hop(1, "198.51.100.1", 3.25));

    adapter.append(first);
    adapter.append(second);
    adapter.append(other);

    RunStore store = adapter.load();
    assertEquals(List.of("example.net", "example.org"), store.targets());
    assertEquals(List.of(first, second), store.history("example.org"));
    assertEquals(List.of(other), store.history("example.net"));
    try (var listing = Files.list(tempDir)) {
      assertEquals(1, listing.count());
    }
  }

  @Test
  void writesSortedKeysWithFourSpaceIndent() throws IOException {
    Path file = tempDir.resolve("layout.json");
    new JsonRunHistoryAdapter(file).append(emptyRun("example.org"));

    String text = Files.readString(file, StandardCharsets.UTF_8);

    assertTrue(text.startsWith("{\n    \"example.org\": [\n        {\n            \"cmd\": "), text);
    assertTrue(text.indexOf("\"cmd\"") < text.indexOf("\"data\""));
    assertTrue(text.indexOf("\"data\"") < text.indexOf("\"description\""));
    assertTrue(text.contains("\"data\": \"No data\""));
    assertTrue(text.endsWith("}\n"));
  }

  @Test
  void appendKeepsExistingRunsAsWritten() throws IOException {
    Path file = tempDir.resolve("legacy.json");
    Files.writeString(file, """
        {"example.org": [{"cmd": "traceroute example.org", "description": ["old run"],
          "timestamp": "2020-05-01 12:00:00", "time_taken_in_secs": 1.50, "operator": "night shift",
          "data": [{"ip_address": "192.0.2.1", "results": [0.250]}]}]}
        """, StandardCharsets.UTF_8);
    JsonRunHistoryAdapter adapter = new JsonRunHistoryAdapter(file, new RunJsonMapper(ZoneOffset.UTC));

    adapter.append(run("example.org", hop(1, "192.0.2.1", 0.3)));

    String text = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(text.contains("\"operator\": \"night shift\""));
    assertTrue(text.contains("\"time_taken_in_secs\": 1.50"));
    assertTrue(text.contains("\"ip_address\": \"192.0.2.1\""));
    assertTrue(text.contains("\"timestamp\": \"2020-05-01 12:00:00\""));
    assertEquals(2, adapter.load().history("example.org").size());
  }

  @Test
  void invalidJsonIsAnIoError() throws IOException {
    Path file = Files.writeString(tempDir.resolve("broken.json"), "{\"example.org\": [");

    assertThrows(IOException.class, () -> new JsonRunHistoryAdapter(file).load());
  }

  @Test
  void rootMustBeAnObject() throws IOException {
    Path file = Files.writeString(tempDir.resolve("array.json"), "[]");
    JsonRunHistoryAdapter adapter = new JsonRunHistoryAdapter(file);

    assertThrows(IOException.class, adapter::load);
    assertThrows(IOException.class, () -> adapter.append(emptyRun("example.org")));
    assertEquals("[]", Files.readString(file));
  }

  @Test
  void targetEntryMustBeAnArray() throws IOException {
    Path file = Files.writeString(tempDir.resolve("scalar.json"), "{\"example.org\": 3}");
    JsonRunHistoryAdapter adapter = new JsonRunHistoryAdapter(file);

    IOException ex = assertThrows(IOException.class, adapter::load);
    assertTrue(ex.getMessage().contains("example.org"));
    assertThrows(IOException.class, () -> adapter.append(emptyRun("example.org")));
  }

  @Test
  void badRunObjectIsReportedWithItsTarget() throws IOException {
    Path file = Files.writeString(tempDir.resolve("bad.json"), "{\"example.org\": [{\"cmd\": 7}]}");

    IOException ex = assertThrows(IOException.class, () -> new JsonRunHistoryAdapter(file).load());
    assertTrue(ex.getMessage().contains("example.org"));
    assertFalse(ex.getMessage().isBlank());
  }
}
