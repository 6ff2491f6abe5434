package com.gentoro.docextract;

import com.gentoro.docextract.exception.ConfigException;
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

/**
 * Loads the application configuration from YAML.
 *
 * <p>An explicit file wins; otherwise the bundled {@code application.yaml} is read from the
 * classpath. Values may reference environment variables with {@code ${env:NAME}}, which Commons
 * Configuration resolves on access.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.docextract.logging.LoggingService.getLogger(ConfigurationProvider.class);
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration config;

  public ConfigurationProvider(Path configFile) {
    this.config = new YAMLConfiguration();
    if (configFile != null) {
      if (!Files.isRegularFile(configFile)) {
        throw new ConfigException("Configuration file not found: " + configFile);
      }
      log.info("Loading configuration from {}", configFile);
      try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
        config.read(reader);
      } catch (IOException | ConfigurationException e) {
        throw new ConfigException("Failed to read configuration file " + configFile, e);
      }
    } else {
      log.info("Loading bundled configuration {}", DEFAULT_RESOURCE);
      try (InputStream in =
          ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
        if (in == null) {
          throw new ConfigException("Missing bundled configuration " + DEFAULT_RESOURCE);
        }
        config.read(new InputStreamReader(in, StandardCharsets.UTF_8));
      } catch (IOException | ConfigurationException e) {
        throw new ConfigException("Failed to read bundled configuration", e);
      }
    }
  }

  public Configuration config() {
    return config;
  }
}
