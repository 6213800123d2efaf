package com.gentoro.doctrans;

import com.gentoro.doctrans.exception.ConfigException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/** Loads the YAML application configuration from an explicit file or from the classpath. */
public class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config = new YAMLConfiguration();

  public ConfigurationProvider(String configFile) {
    try {
      if (configFile != null && !configFile.isBlank()) {
        Path path = Path.of(configFile);
        if (!Files.isRegularFile(path)) {
          throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
          config.read(reader);
        }
      } else {
        try (InputStream in =
            ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
          if (in == null) {
            throw new ConfigException("Missing classpath resource " + DEFAULT_RESOURCE);
          }
          config.read(in);
        }
      }
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to load configuration", e);
    }
  }

  public Configuration config() {
    return config;
  }
}
