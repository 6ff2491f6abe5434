package com.gentoro.docextract;

import com.gentoro.docextract.exception.ConfigException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line arguments of the form {@code --key=value} or {@code --flag}.
 *
 * <p>Recognized keys: {@code mode} ({@code server} or {@code batch}, default {@code server}),
 * {@code config-file}, {@code input}, {@code name} and {@code extract} ({@code text} or {@code
 * table}).
 */
public final class StartupParameters {
  private final Map<String, String> values = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unrecognized argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        values.put(body, "true");
      } else {
        values.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public boolean has(String key) {
    return values.containsKey(key);
  }

  public String getParameter(String key, String defaultValue) {
    return values.getOrDefault(key, defaultValue);
  }

  public <T> T getParameter(String key, Class<T> type) {
    String raw = values.get(key);
    if (raw == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(raw);
    }
    if (type == Integer.class) {
      try {
        return type.cast(Integer.valueOf(raw));
      } catch (NumberFormatException e) {
        throw new ConfigException("Argument --%s must be an integer".formatted(key), e);
      }
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.valueOf(raw));
    }
    if (type == Path.class) {
      return type.cast(Path.of(raw));
    }
    throw new ConfigException("Unsupported argument type: " + type.getName());
  }

  public String mode() {
    return getParameter("mode", "server");
  }

  public Path configFile() {
    return getParameter("config-file", Path.class);
  }
}
