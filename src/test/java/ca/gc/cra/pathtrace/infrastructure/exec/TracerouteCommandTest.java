package ca.gc.cra.pathtrace.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.pathtrace.config.TraceConfig;
import ca.gc.cra.pathtrace.domain.probe.Dialect;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TracerouteCommandTest {

  @Test
  void defaultsForModernTraceroute() {
    TracerouteCommand command = TracerouteCommand.of(TraceConfig.defaults("example.org"), Dialect.MODERN);

    assertEquals(List.of("traceroute", "-m", "64", "--udp", "-p", "33434", "-q", "3", "-w", "3", "example.org"),
        command.argv());
    assertEquals("traceroute -m 64 --udp -p 33434 -q 3 -w 3 example.org", command.commandText());
  }

  @Test
  void inetutilsSpellsProbeMethodAndResolvesNames() {
    TraceConfig config = TraceConfig.fromMap(Map.of(
        "target", "192.0.2.10",
        "connectionType", "icmp",
        "resolveHostnames", "true",
        "tries", "1",
        "wait", "5"));

    TracerouteCommand command = TracerouteCommand.of(config, Dialect.INETUTILS);

    assertEquals(List.of("traceroute", "-m", "64", "-M", "icmp", "-p", "33434", "-q", "1",
        "--resolve-hostnames", "-w", "5", "192.0.2.10"), command.argv());
  }

  @Test
  void modernIgnoresHostnameResolutionFlag() {
    TraceConfig config = TraceConfig.fromMap(Map.of("target", "example.org", "resolveHostnames", "true"));

    TracerouteCommand command = TracerouteCommand.of(config, Dialect.MODERN);

    assertEquals(-1, command.argv().indexOf("--resolve-hostnames"));
  }

  @Test
  void optionalFlagsPrecedeMaxHop() {
    TraceConfig config = TraceConfig.fromMap(Map.of(
        "target", "example.org",
        "firstHop", "2",
        "gateways", "10.0.0.1,10.0.0.2",
        "icmp", "true",
        "maxHop", "20",
        "typeOfService", "16"));

    TracerouteCommand command = TracerouteCommand.of(config, Dialect.MODERN);

    assertEquals(List.of("traceroute", "-f", "2", "-g", "10.0.0.1 10.0.0.2", "-I", "-m", "20", "--udp",
        "-p", "33434", "-q", "3", "-t", "16", "-w", "3", "example.org"), command.argv());
    assertEquals(command.commandText(), command.toString());
  }
}
