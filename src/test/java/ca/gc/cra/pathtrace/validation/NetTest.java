package ca.gc.cra.pathtrace.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void recognizesIpv4Literals() {
    assertTrue(Net.isIpv4Literal("93.184.216.34"));
    assertTrue(Net.isIpv4Literal("0.0.0.0"));
    assertFalse(Net.isIpv4Literal("256.1.1.1"));
    assertFalse(Net.isIpv4Literal("10.0.0"));
    assertFalse(Net.isIpv4Literal("(10.0.0.1)"));
    assertFalse(Net.isIpv4Literal(null));
  }

  @Test
  void validateTargetAcceptsHostnamesAndAddresses() {
    assertEquals("example.org", Net.validateTarget(" example.org "));
    assertEquals("192.0.2.7", Net.validateTarget("192.0.2.7"));
    assertEquals("core-router_1.example.net.", Net.validateTarget("core-router_1.example.net."));
  }

  @Test
  void validateTargetRejectsBadOctets() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateTarget("300.1.1.1"));
  }

  @Test
  void validateTargetRejectsBadLabels() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateTarget("-bad.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateTarget("a..b"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateTarget("host name"));
  }
}
