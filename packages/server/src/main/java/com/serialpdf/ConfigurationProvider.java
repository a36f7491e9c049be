package com.serialpdf;

import com.serialpdf.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/** Loads the YAML application configuration, from a file or the bundled classpath resource. */
public class ConfigurationProvider {
  private static final Logger log =
      com.serialpdf.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path configFile) {
    this.config = new YAMLConfiguration();
    if (configFile == null) {
      loadResource(DEFAULT_RESOURCE);
    } else {
      loadFile(configFile);
    }
  }

  private void loadFile(Path configFile) {
    if (!Files.isRegularFile(configFile)) {
      throw new ConfigException("Configuration file not found: " + configFile);
    }
    try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
      config.read(reader);
      log.info("Loaded configuration from {}", configFile.toAbsolutePath());
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Could not read configuration file " + configFile, e);
    }
  }

  private void loadResource(String name) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(name);
    if (in == null) {
      throw new ConfigException("Configuration resource not found on classpath: " + name);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      config.read(reader);
      log.info("Loaded bundled configuration '{}'", name);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Could not read configuration resource " + name, e);
    }
  }

  public Configuration config() {
    return config;
  }
}
