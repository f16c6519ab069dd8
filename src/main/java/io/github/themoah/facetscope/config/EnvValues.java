package io.github.themoah.facetscope.config;

import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed environment variable lookups that fall back to defaults on missing or invalid values.
 */
public final class EnvValues {

  private static final Logger log = LoggerFactory.getLogger(EnvValues.class);

  private EnvValues() {}

  public static int getInt(String name, int defaultValue) {
    return getInt(System.getenv(), name, defaultValue);
  }

  public static long getLong(String name, long defaultValue) {
    return getLong(System.getenv(), name, defaultValue);
  }

  public static String getString(String name, String defaultValue) {
    return getString(System.getenv(), name, defaultValue);
  }

  public static boolean getBoolean(String name, boolean defaultValue) {
    return getBoolean(System.getenv(), name, defaultValue);
  }

  static int getInt(Map<String, String> env, String name, int defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  static long getLong(Map<String, String> env, String name, long defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  static String getString(Map<String, String> env, String name, String defaultValue) {
    String value = env.get(name);
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return "true".equalsIgnoreCase(value.trim());
  }
}
