package io.github.themoah.facetscope.clickhouse;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads SQL templates from {@code sql/<name>.sql} on the classpath and fills {@code {{param}}} placeholders.
 */
public final class SqlTemplates {

  private static final String BASE_PATH = "sql/";
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)\\}\\}");
  private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

  private SqlTemplates() {}

  /**
   * Loads a template and interpolates its parameters.
   *
   * @param name template name without extension
   * @param params placeholder values
   * @return the rendered SQL
   * @throws IllegalStateException if the template does not exist
   * @throws IllegalArgumentException if a placeholder has no value
   */
  public static String render(String name, Map<String, String> params) {
    return interpolate(load(name), params);
  }

  static String load(String name) {
    return CACHE.computeIfAbsent(name, SqlTemplates::read);
  }

  static String interpolate(String template, Map<String, String> params) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder();
    while (matcher.find()) {
      String key = matcher.group(1);
      String value = params.get(key);
      if (value == null) {
        throw new IllegalArgumentException("Missing SQL template parameter: " + key);
      }
      matcher.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  private static String read(String name) {
    String resource = BASE_PATH + name + ".sql";
    try (InputStream is = SqlTemplates.class.getClassLoader().getResourceAsStream(resource)) {
      if (is == null) {
        throw new IllegalStateException("SQL template not found on classpath: " + resource);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read SQL template: " + resource, e);
    }
  }
}
