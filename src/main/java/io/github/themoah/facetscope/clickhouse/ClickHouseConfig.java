package io.github.themoah.facetscope.clickhouse;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection settings for the ClickHouse HTTP interface.
 */
public class ClickHouseConfig {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_URL = "clickhouse.url";
  private static final String PROP_USER = "clickhouse.user";
  private static final String PROP_PASSWORD = "clickhouse.password";
  private static final String PROP_DATABASE = "clickhouse.database";
  private static final String PROP_TABLE = "clickhouse.table";
  private static final String PROP_REQUEST_TIMEOUT_MS = "clickhouse.request.timeout.ms";
  private static final String PROP_QUERY_CACHE_TTL_S = "clickhouse.query.cache.ttl.s";

  private static final String DEFAULT_URL = "http://localhost:8123/";
  private static final String DEFAULT_USER = "default";
  private static final String DEFAULT_DATABASE = "helix_logs_production";
  private static final String DEFAULT_TABLE = "cdn_requests_v2";
  private static final int DEFAULT_REQUEST_TIMEOUT_MS = 30000;
  private static final int DEFAULT_QUERY_CACHE_TTL_S = 60;

  private final String url;
  private final String user;
  private final String password;
  private final String database;
  private final String table;
  private final int requestTimeoutMs;
  private final int queryCacheTtlSeconds;

  private ClickHouseConfig(Builder builder) {
    this.url = builder.url;
    this.user = builder.user;
    this.password = builder.password;
    this.database = builder.database;
    this.table = builder.table;
    this.requestTimeoutMs = builder.requestTimeoutMs;
    this.queryCacheTtlSeconds = builder.queryCacheTtlSeconds;
  }

  public String getUrl() {
    return url;
  }

  public String getUser() {
    return user;
  }

  public String getPassword() {
    return password;
  }

  public String getDatabase() {
    return database;
  }

  public String getTable() {
    return table;
  }

  public int getRequestTimeoutMs() {
    return requestTimeoutMs;
  }

  public int getQueryCacheTtlSeconds() {
    return queryCacheTtlSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ClickHouseConfig fromEnvironment() {
    return builder()
      .url(System.getenv().getOrDefault("CLICKHOUSE_URL", DEFAULT_URL))
      .user(System.getenv().getOrDefault("CLICKHOUSE_USER", DEFAULT_USER))
      .password(System.getenv().getOrDefault("CLICKHOUSE_PASSWORD", ""))
      .database(System.getenv().getOrDefault("CLICKHOUSE_DATABASE", DEFAULT_DATABASE))
      .table(System.getenv().getOrDefault("CLICKHOUSE_TABLE", DEFAULT_TABLE))
      .requestTimeoutMs(Integer.parseInt(
        System.getenv().getOrDefault("CLICKHOUSE_REQUEST_TIMEOUT_MS", String.valueOf(DEFAULT_REQUEST_TIMEOUT_MS))))
      .queryCacheTtlSeconds(Integer.parseInt(
        System.getenv().getOrDefault("CLICKHOUSE_QUERY_CACHE_TTL_S", String.valueOf(DEFAULT_QUERY_CACHE_TTL_S))))
      .build();
  }

  /**
   * Loads configuration from the default application.properties file on the classpath.
   *
   * @return ClickHouseConfig loaded from classpath
   * @throws IOException if the config file cannot be read
   */
  public static ClickHouseConfig fromClasspath() throws IOException {
    return fromClasspath(DEFAULT_CONFIG_FILE);
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @return ClickHouseConfig loaded from the resource
   * @throws IOException if the config file cannot be read
   */
  public static ClickHouseConfig fromClasspath(String resourceName) throws IOException {
    log.info("Loading configuration from classpath: {}", resourceName);
    try (InputStream is = ClickHouseConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  public static ClickHouseConfig fromFile(Path path) throws IOException {
    log.info("Loading configuration from file: {}", path);
    try (InputStream is = Files.newInputStream(path)) {
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from a Properties object. Missing keys keep their defaults.
   *
   * @param props the properties containing clickhouse.* configuration
   * @return ClickHouseConfig built from the properties
   */
  public static ClickHouseConfig fromProperties(Properties props) {
    Builder builder = builder();

    setIfPresent(props, PROP_URL, builder::url);
    setIfPresent(props, PROP_USER, builder::user);
    setIfPresent(props, PROP_PASSWORD, builder::password);
    setIfPresent(props, PROP_DATABASE, builder::database);
    setIfPresent(props, PROP_TABLE, builder::table);
    setIfPresent(props, PROP_REQUEST_TIMEOUT_MS, v -> builder.requestTimeoutMs(Integer.parseInt(v)));
    setIfPresent(props, PROP_QUERY_CACHE_TTL_S, v -> builder.queryCacheTtlSeconds(Integer.parseInt(v)));

    log.info("Configuration loaded: url={}, database={}, table={}", builder.url, builder.database, builder.table);
    return builder.build();
  }

  private static void setIfPresent(Properties props, String key, Consumer<String> setter) {
    String value = props.getProperty(key);
    if (value != null && !value.isBlank()) {
      setter.accept(value.trim());
    }
  }

  public static class Builder {

    private String url = DEFAULT_URL;
    private String user = DEFAULT_USER;
    private String password = "";
    private String database = DEFAULT_DATABASE;
    private String table = DEFAULT_TABLE;
    private int requestTimeoutMs = DEFAULT_REQUEST_TIMEOUT_MS;
    private int queryCacheTtlSeconds = DEFAULT_QUERY_CACHE_TTL_S;

    public Builder url(String url) {
      this.url = Objects.requireNonNull(url, "url cannot be null");
      return this;
    }

    public Builder user(String user) {
      this.user = Objects.requireNonNull(user, "user cannot be null");
      return this;
    }

    public Builder password(String password) {
      this.password = password == null ? "" : password;
      return this;
    }

    public Builder database(String database) {
      this.database = Objects.requireNonNull(database, "database cannot be null");
      return this;
    }

    public Builder table(String table) {
      this.table = Objects.requireNonNull(table, "table cannot be null");
      return this;
    }

    public Builder requestTimeoutMs(int requestTimeoutMs) {
      this.requestTimeoutMs = requestTimeoutMs;
      return this;
    }

    public Builder queryCacheTtlSeconds(int queryCacheTtlSeconds) {
      this.queryCacheTtlSeconds = queryCacheTtlSeconds;
      return this;
    }

    public ClickHouseConfig build() {
      return new ClickHouseConfig(this);
    }
  }
}
