package com.serialpdf;

import static org.junit.jupiter.api.Assertions.*;

import com.serialpdf.exception.ConfigException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesNamedValuesAndFlags() {
    StartupParameters params =
        new StartupParameters(new String[] {"--port=8081", "--verbose", "--name=a=b"}, Map.of());

    assertEquals(8081, params.getParameter("port", Integer.class));
    assertTrue(params.getParameter("verbose", Boolean.class));
    assertEquals("a=b", params.getParameter("name", String.class));
    assertNull(params.getParameter("missing", String.class));
  }

  @Test
  void rejectsPositionalArguments() {
    assertThrows(
        ConfigException.class,
        () -> new StartupParameters(new String[] {"config.yaml"}, Map.of()));
    assertThrows(ConfigException.class, () -> new StartupParameters(new String[] {"--"}, Map.of()));
  }

  @Test
  void configFileFromArgumentOrEnvironment() {
    Map<String, String> env = Map.of(StartupParameters.CONFIG_ENV, "/etc/serial-pdf.yaml");

    assertEquals(
        Path.of("/tmp/other.yaml"),
        new StartupParameters(new String[] {"--config=/tmp/other.yaml"}, env).configFile());
    assertEquals(Path.of("/etc/serial-pdf.yaml"), new StartupParameters(null, env).configFile());
    assertNull(new StartupParameters(new String[0], Map.of()).configFile());
  }
}
