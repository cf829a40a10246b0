package ca.gc.cra.pathtrace.domain.probe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class DialectTest {

  @Test
  void modernClassifiesParenthesizedAddressAndBareTime() {
    assertEquals(new ProbeToken(TokenKind.ADDRESS, "192.0.2.1"), Dialect.MODERN.classify("(192.0.2.1)"));
    assertEquals(new ProbeToken(TokenKind.TIME, "11.2"), Dialect.MODERN.classify("11.2"));
    assertEquals(new ProbeToken(TokenKind.TIME, ".5"), Dialect.MODERN.classify(".5"));
    assertEquals(new ProbeToken(TokenKind.NAME, "router.example"), Dialect.MODERN.classify("router.example"));
    assertEquals(TokenKind.IGNORED, Dialect.MODERN.classify("ms").kind());
  }

  @Test
  void modernTreatsBareAddressAsName() {
    assertEquals(new ProbeToken(TokenKind.NAME, "192.0.2.1"), Dialect.MODERN.classify("192.0.2.1"));
  }

  @Test
  void inetutilsClassifiesBareAddressAndSuffixedTime() {
    assertEquals(new ProbeToken(TokenKind.ADDRESS, "192.0.2.1"), Dialect.INETUTILS.classify("192.0.2.1"));
    assertEquals(new ProbeToken(TokenKind.TIME, "11.2"), Dialect.INETUTILS.classify("11.2ms"));
    assertEquals(new ProbeToken(TokenKind.NAME, "router.example"), Dialect.INETUTILS.classify("(router.example)"));
  }

  @Test
  void inetutilsIgnoresParenthesizedAddressAndBareNumbers() {
    assertEquals(TokenKind.IGNORED, Dialect.INETUTILS.classify("(192.0.2.1)").kind());
    assertEquals(TokenKind.IGNORED, Dialect.INETUTILS.classify("11.2").kind());
    assertEquals(TokenKind.IGNORED, Dialect.INETUTILS.classify("ms").kind());
    assertEquals(TokenKind.IGNORED, Dialect.INETUTILS.classify("()").kind());
  }

  @Test
  void timeoutAndAnnotationsAreDialectIndependent() {
    for (Dialect dialect : Dialect.values()) {
      assertEquals(TokenKind.TIMEOUT, dialect.classify("*").kind());
      assertEquals(TokenKind.IGNORED, dialect.classify("!H").kind());
      assertEquals(TokenKind.IGNORED, dialect.classify("!N").kind());
    }
  }

  @Test
  void timeTokenExposesMillis() {
    assertEquals(0.5, Dialect.MODERN.classify(".5").millis());
    assertThrows(IllegalStateException.class, () -> Dialect.MODERN.classify("*").millis());
  }

  @Test
  void resolvesVersionBanners() {
    assertEquals(Dialect.MODERN, Dialect.fromVersionBanner("Modern traceroute for Linux, version 2.1.0"));
    assertEquals(Dialect.INETUTILS, Dialect.fromVersionBanner("traceroute (GNU inetutils) 1.9.4"));
    assertThrows(UnknownDialectException.class, () -> Dialect.fromVersionBanner("tracert 1.0"));
    assertThrows(UnknownDialectException.class, () -> Dialect.fromVersionBanner(null));
  }

  @Test
  void resolvesNamesCaseInsensitively() {
    assertEquals(Dialect.INETUTILS, Dialect.fromName(" InetUtils "));
    assertEquals(Dialect.MODERN, Dialect.fromName("modern"));
    assertThrows(UnknownDialectException.class, () -> Dialect.fromName("busybox"));
    assertThrows(UnknownDialectException.class, () -> Dialect.fromName(""));
  }
}
