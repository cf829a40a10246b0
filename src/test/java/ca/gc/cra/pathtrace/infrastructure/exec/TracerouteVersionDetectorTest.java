package ca.gc.cra.pathtrace.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import ca.gc.cra.pathtrace.domain.probe.UnknownDialectException;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class TracerouteVersionDetectorTest {

  @Test
  void modernBannerIsRecognised() throws Exception {
    TracerouteVersionDetector detector =
        new TracerouteVersionDetector(List.of("echo", "Modern traceroute for Linux, version 2.1.0"));

    assertEquals(Dialect.MODERN, detector.detect());
  }

  @Test
  void inetutilsBannerIsRecognised() throws Exception {
    TracerouteVersionDetector detector =
        new TracerouteVersionDetector(List.of("echo", "traceroute (GNU inetutils) 2.0"));

    assertEquals(Dialect.INETUTILS, detector.detect());
  }

  @Test
  void unknownBannerIsRejected() {
    TracerouteVersionDetector detector = new TracerouteVersionDetector(List.of("echo", "tracert 1.0"));

    assertThrows(UnknownDialectException.class, detector::detect);
  }

  @Test
  void missingExecutableIsAnIoError() {
    TracerouteVersionDetector detector =
        new TracerouteVersionDetector(List.of("pathtrace-no-such-binary", "--version"));

    assertThrows(IOException.class, detector::detect);
  }
}
