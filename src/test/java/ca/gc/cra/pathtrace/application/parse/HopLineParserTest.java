package ca.gc.cra.pathtrace.application.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import ca.gc.cra.pathtrace.domain.probe.HopRecord;
import ca.gc.cra.pathtrace.domain.probe.MalformedHopLineException;
import ca.gc.cra.pathtrace.domain.probe.ProbeCountMismatchException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HopLineParserTest {
  private final HopLineParser parser = new HopLineParser();

  @Test
  void parsesModernHopWithTimeout() throws Exception {
    HopRecord hop = parser.parse("3 (93.184.216.34) 93.184.216.34 11.2 ms 12.0 ms *", Dialect.MODERN, 3);

    assertEquals(3, hop.index());
    assertEquals(Set.of("93.184.216.34"), hop.addresses());
    assertEquals(List.of(11.2, 12.0), hop.samples());
    assertEquals(1, hop.timeouts());
    assertEquals(Optional.empty(), hop.hostname());
  }

  @Test
  void parsesModernHopWithResolvedName() throws Exception {
    HopRecord hop = parser.parse(
        " 2  gw.example.net (198.51.100.1)  0.512 ms  0.498 ms  0.601 ms", Dialect.MODERN, 3);

    assertEquals(2, hop.index());
    assertEquals(Set.of("198.51.100.1"), hop.addresses());
    assertEquals(Optional.of("gw.example.net"), hop.hostname());
    assertEquals(List.of(0.512, 0.498, 0.601), hop.samples());
    assertEquals(0, hop.timeouts());
  }

  @Test
  void parsesInetutilsHop() throws Exception {
    HopRecord hop = parser.parse(
        "4   203.0.113.9 (edge.example.org)  7.1ms  7.4ms  7.0ms", Dialect.INETUTILS, 3);

    assertEquals(Set.of("203.0.113.9"), hop.addresses());
    assertEquals(Optional.of("edge.example.org"), hop.hostname());
    assertEquals(List.of(7.1, 7.4, 7.0), hop.samples());
  }

  @Test
  void dropsHostnameWhenSeveralAddressesAnswerModern() throws Exception {
    HopRecord hop = parser.parse(
        "5 r1.example (10.0.0.1) 1.0 ms r2.example (10.0.0.2) 2.0 ms 3.0 ms", Dialect.MODERN, 3);

    assertEquals(Set.of("10.0.0.1", "10.0.0.2"), hop.addresses());
    assertEquals(Optional.empty(), hop.hostname());
    assertEquals(3, hop.samples().size());
  }

  @Test
  void dropsHostnameWhenSeveralAddressesAnswerInetutils() throws Exception {
    HopRecord hop = parser.parse(
        "5 10.0.0.1 (r1.example) 1.0ms 10.0.0.2 (r2.example) 2.0ms 3.0ms", Dialect.INETUTILS, 3);

    assertEquals(Set.of("10.0.0.1", "10.0.0.2"), hop.addresses());
    assertEquals(Optional.empty(), hop.hostname());
  }

  @Test
  void allTimeoutsYieldNoAddress() throws Exception {
    HopRecord hop = parser.parse("7  * * *", Dialect.MODERN, 3);

    assertTrue(hop.addresses().isEmpty());
    assertTrue(hop.samples().isEmpty());
    assertEquals(3, hop.timeouts());
  }

  @Test
  void annotationsDoNotCountAsProbes() throws Exception {
    HopRecord hop = parser.parse("9 (192.0.2.1) 1.0 ms !H 1.1 ms !H 1.2 ms !H", Dialect.MODERN, 3);
    assertEquals(3, hop.samples().size());
  }

  @Test
  void rejectsTooFewProbeOutcomes() {
    ProbeCountMismatchException ex = assertThrows(ProbeCountMismatchException.class,
        () -> parser.parse("3 (10.0.0.1) 1.0 ms 2.0 ms", Dialect.MODERN, 3));
    assertEquals(3, ex.expected());
    assertEquals(2, ex.observed());
    assertEquals(Optional.of("3 (10.0.0.1) 1.0 ms 2.0 ms"), ex.line());
  }

  @Test
  void rejectsBlankLine() {
    assertThrows(MalformedHopLineException.class, () -> parser.parse("   ", Dialect.MODERN, 3));
  }

  @Test
  void rejectsLineWithoutIndex() {
    assertThrows(MalformedHopLineException.class,
        () -> parser.parse("traceroute to example.org (93.184.216.34), 64 hops max", Dialect.MODERN, 3));
  }

  @Test
  void rejectsNonPositiveTries() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("1 * * *", Dialect.MODERN, 0));
  }
}
