package io.intellixity.tessel.persistence.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings read from {@link Properties} under the {@code tessel.datasource.} prefix.
 *
 * <pre>
 * tessel.datasource.jdbcUrl=jdbc:postgresql://localhost:5432/shop
 * tessel.datasource.username=shop
 * tessel.datasource.password=secret
 * tessel.datasource.schema=public
 * tessel.datasource.readOnlyJdbcUrl=jdbc:postgresql://replica:5432/shop
 * tessel.datasource.maximumPoolSize=10
 * </pre>
 */
public record JdbcPoolSettings(String jdbcUrl,
                               String username,
                               String password,
                               String schema,
                               String readOnlyJdbcUrl,
                               int maximumPoolSize) {
  public static final String PREFIX = "tessel.datasource.";
  public static final String DEFAULT_RESOURCE = "tessel.properties";

  public JdbcPoolSettings {
    if (jdbcUrl == null || jdbcUrl.isBlank()) throw new IllegalArgumentException("Missing " + PREFIX + "jdbcUrl");
    schema = (schema == null || schema.isBlank()) ? "public" : schema;
    readOnlyJdbcUrl = (readOnlyJdbcUrl == null || readOnlyJdbcUrl.isBlank()) ? null : readOnlyJdbcUrl;
    if (maximumPoolSize < 1) throw new IllegalArgumentException(PREFIX + "maximumPoolSize must be positive: " + maximumPoolSize);
  }

  public boolean hasReadOnly() {
    return readOnlyJdbcUrl != null;
  }

  /** Loads {@code tessel.properties} from the classpath. */
  public static JdbcPoolSettings load() {
    return load(DEFAULT_RESOURCE);
  }

  public static JdbcPoolSettings load(String resource) {
    Objects.requireNonNull(resource, "resource");
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JdbcPoolSettings.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("Resource not found on classpath: " + resource);
      Properties props = new Properties();
      props.load(in);
      return from(props);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }

  public static JdbcPoolSettings from(Properties props) {
    Objects.requireNonNull(props, "props");
    String size = props.getProperty(PREFIX + "maximumPoolSize");
    int maximumPoolSize;
    try {
      maximumPoolSize = (size == null || size.isBlank()) ? 10 : Integer.parseInt(size.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + PREFIX + "maximumPoolSize: " + size, e);
    }
    return new JdbcPoolSettings(
        trimmed(props, "jdbcUrl"),
        trimmed(props, "username"),
        props.getProperty(PREFIX + "password"),
        trimmed(props, "schema"),
        trimmed(props, "readOnlyJdbcUrl"),
        maximumPoolSize);
  }

  private static String trimmed(Properties props, String key) {
    String v = props.getProperty(PREFIX + key);
    return (v == null) ? null : v.trim();
  }

  @Override
  public String toString() {
    return "JdbcPoolSettings[jdbcUrl=" + jdbcUrl + ", username=" + username + ", schema=" + schema
        + ", readOnlyJdbcUrl=" + readOnlyJdbcUrl + ", maximumPoolSize=" + maximumPoolSize + "]";
  }
}
