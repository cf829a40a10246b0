package ca.gc.cra.pathtrace.infrastructure.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.pathtrace.domain.probe.Dialect;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReaderProbeOutputSourceTest {
  @TempDir Path tempDir;

  @Test
  void readsCapturedFile() throws IOException {
    Path capture = Files.writeString(tempDir.resolve("capture.txt"),
        "traceroute to example.org (192.0.2.1)\n  1  (192.0.2.1)  0.5 ms  \n");

    try (ReaderProbeOutputSource source =
        ReaderProbeOutputSource.open(capture, "example.org", "traceroute example.org", Dialect.INETUTILS, 1)) {
      assertEquals("example.org", source.target());
      assertEquals(Dialect.INETUTILS, source.dialect());
      assertEquals("traceroute to example.org (192.0.2.1)", source.banner());
      assertEquals("1  (192.0.2.1)  0.5 ms", source.nextLine());
      assertNull(source.nextLine());
    }
  }

  @Test
  void streamStaysOpenAfterClose() throws IOException {
    TrackingStream in = new TrackingStream("traceroute to host\n".getBytes(StandardCharsets.UTF_8));

    ReaderProbeOutputSource source = ReaderProbeOutputSource.ofStream(in, "host", "cmd", Dialect.MODERN, 3);
    assertEquals("traceroute to host", source.banner());
    source.close();

    assertFalse(in.closed);
  }

  private static final class TrackingStream extends ByteArrayInputStream {
    private boolean closed;

    TrackingStream(byte[] bytes) {
      super(bytes);
    }

    @Override
    public void close() throws IOException {
      closed = true;
      super.close();
    }
  }
}
