package ca.gc.cra.pathtrace.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.pathtrace.application.parse.HopLineParser;
import ca.gc.cra.pathtrace.domain.probe.Dialect;
import ca.gc.cra.pathtrace.domain.probe.InvalidProbeArgumentException;
import ca.gc.cra.pathtrace.domain.probe.MalformedHopLineException;
import ca.gc.cra.pathtrace.domain.probe.ProbeCountMismatchException;
import ca.gc.cra.pathtrace.domain.probe.RunResult;
import ca.gc.cra.pathtrace.domain.probe.UnresolvedHostException;
import ca.gc.cra.pathtrace.testutil.ProbeFixtures;
import ca.gc.cra.pathtrace.testutil.ProbeFixtures.SteppingClock;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RunAssemblerTest {
  private static final String BANNER = "traceroute to example.org (93.184.216.34), 64 hops max, 60 byte packets";

  private final RunAssembler assembler =
      new RunAssembler(new HopLineParser(), new SteppingClock(ProbeFixtures.T0, 1_500_000_000L));

  @Test
  void assemblesHopsInOrder() throws Exception {
    RunResult run = assembler.assemble(ProbeFixtures.scripted("example.org", Dialect.MODERN, 3,
        BANNER,
        " 1  gw.example.net (192.168.1.1)  0.512 ms  0.498 ms  0.601 ms",
        " 2  * * *",
        " 3  (93.184.216.34)  11.2 ms  12.0 ms  11.8 ms"));

    assertEquals("example.org", run.target());
    assertEquals("traceroute -q 3 example.org", run.command());
    assertEquals(BANNER, run.description());
    assertEquals(ProbeFixtures.T0, run.timestamp());
    assertEquals(1.5, run.durationSeconds(), 1e-9);
    assertEquals(List.of(1, 2, 3), run.hops().stream().map(hop -> hop.index()).toList());
    assertEquals(Set.of("93.184.216.34"), run.hops().get(2).addresses());
  }

  @Test
  void stopsAtFirstBlankLine() throws Exception {
    RunResult run = assembler.assemble(ProbeFixtures.scripted("example.org", Dialect.MODERN, 1,
        BANNER,
        "1 (10.0.0.1) 1.0 ms",
        "",
        "this would not parse"));

    assertEquals(1, run.hops().size());
  }

  @Test
  void bannerOnlyYieldsRunWithoutData() throws Exception {
    RunResult run = assembler.assemble(ProbeFixtures.scripted("example.org", Dialect.MODERN, 3, BANNER));

    assertFalse(run.hasData());
    assertEquals(BANNER, run.description());
  }

  @Test
  void unresolvedTargetFailsFast() {
    UnresolvedHostException ex = assertThrows(UnresolvedHostException.class,
        () -> assembler.assemble(ProbeFixtures.scripted("no-such-host.invalid", Dialect.MODERN, 3,
            "no-such-host.invalid: Name or service not known")));
    assertTrue(ex.line().isPresent());
  }

  @Test
  void invalidArgumentIsReported() {
    assertThrows(InvalidProbeArgumentException.class,
        () -> assembler.assemble(ProbeFixtures.scripted("example.org", Dialect.INETUTILS, 3,
            BANNER, "traceroute: invalid argument 'x' for -q")));
  }

  @Test
  void outOfOrderIndexIsMalformed() {
    assertThrows(MalformedHopLineException.class,
        () -> assembler.assemble(ProbeFixtures.scripted("example.org", Dialect.MODERN, 1,
            BANNER, "2 (10.0.0.2) 1.0 ms", "2 (10.0.0.3) 1.0 ms")));
  }

  @Test
  void probeCountMismatchPropagates() {
    assertThrows(ProbeCountMismatchException.class,
        () -> assembler.assemble(ProbeFixtures.scripted("example.org", Dialect.MODERN, 3,
            BANNER, "1 (10.0.0.1) 1.0 ms 2.0 ms")));
  }
}
