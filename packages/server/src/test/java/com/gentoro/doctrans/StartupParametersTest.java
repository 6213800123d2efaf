package com.gentoro.doctrans;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesNamedValuesAndFlags() {
    StartupParameters params =
        new StartupParameters(new String[] {"--config=/etc/doctrans.yaml", "--verbose", "stray"});
    assertEquals("/etc/doctrans.yaml", params.configFile());
    assertEquals("true", params.getParameter("verbose"));
    assertNull(params.getParameter("stray"));
    assertEquals("x", params.getParameter("missing", "x"));
  }

  @Test
  void noArgumentsMeansBundledConfiguration() {
    assertNull(new StartupParameters(null).configFile());
  }
}
