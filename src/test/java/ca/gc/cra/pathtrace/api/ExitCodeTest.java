package ca.gc.cra.pathtrace.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.pathtrace.domain.probe.UnknownDialectException;
import ca.gc.cra.pathtrace.domain.probe.UnresolvedHostException;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class ExitCodeTest {

  @Test
  void mapsFailuresByKind() {
    assertEquals(ExitCode.PROBE_FAILURE,
        ExitCode.forFailure(new UnresolvedHostException("nope.invalid", "traceroute: unknown host nope.invalid")));
    assertEquals(ExitCode.IO_ERROR, ExitCode.forFailure(new IOException("disk full")));
    assertEquals(ExitCode.INTERRUPTED, ExitCode.forFailure(new InterruptedException()));
    assertEquals(ExitCode.CONFIG_ERROR, ExitCode.forFailure(new UnknownDialectException("BusyBox")));
    assertEquals(ExitCode.RUNTIME_FAILURE,
        ExitCode.forFailure(new UncheckedIOException(new IOException("pipe closed"))));
  }

  @Test
  void probeFailureIsDistinctFromLocalErrors() {
    assertEquals(6, ExitCode.PROBE_FAILURE.code());
    assertEquals(3, ExitCode.IO_ERROR.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }
}
