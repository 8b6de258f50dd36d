package io.intellixity.reltab.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for {@link JdbcConnections#open(ConnectionSettings)}.
 *
 * <pre>
 * reltab.jdbc.url=jdbc:h2:mem:pivot        (required)
 * reltab.jdbc.username=sa
 * reltab.jdbc.password=
 * reltab.jdbc.maxPoolSize=10
 * reltab.dialect=h2
 * reltab.eval.threads=4
 * reltab.schemaCache.maxEntries=256
 * reltab.schemaCache.ttlMillis=600000
 * </pre>
 */
public record ConnectionSettings(String url,
                                 String username,
                                 String password,
                                 int maxPoolSize,
                                 String dialect,
                                 int evalThreads,
                                 int schemaCacheMaxEntries,
                                 long schemaCacheTtlMillis) {
  public static final String PREFIX = "reltab.";

  public ConnectionSettings {
    if (url == null || url.isBlank()) throw new IllegalArgumentException("Missing " + PREFIX + "jdbc.url");
    if (maxPoolSize <= 0) throw new IllegalArgumentException(PREFIX + "jdbc.maxPoolSize must be > 0");
    if (evalThreads <= 0) throw new IllegalArgumentException(PREFIX + "eval.threads must be > 0");
    if (schemaCacheMaxEntries <= 0) throw new IllegalArgumentException(PREFIX + "schemaCache.maxEntries must be > 0");
    if (schemaCacheTtlMillis < 0) throw new IllegalArgumentException(PREFIX + "schemaCache.ttlMillis must be >= 0");
    dialect = (dialect == null || dialect.isBlank()) ? "h2" : dialect.trim();
  }

  /** Defaults for everything but the URL and credentials. */
  public static ConnectionSettings of(String url, String username, String password) {
    return new ConnectionSettings(url, username, password, 10, "h2", 4, 256, 600_000L);
  }

  public ConnectionSettings withDialect(String dialect) {
    return new ConnectionSettings(url, username, password, maxPoolSize, dialect, evalThreads,
        schemaCacheMaxEntries, schemaCacheTtlMillis);
  }

  public static ConnectionSettings fromProperties(Properties p) {
    Objects.requireNonNull(p, "properties");
    return new ConnectionSettings(
        p.getProperty(PREFIX + "jdbc.url"),
        p.getProperty(PREFIX + "jdbc.username"),
        p.getProperty(PREFIX + "jdbc.password"),
        intProp(p, "jdbc.maxPoolSize", 10),
        p.getProperty(PREFIX + "dialect", "h2"),
        intProp(p, "eval.threads", 4),
        intProp(p, "schemaCache.maxEntries", 256),
        longProp(p, "schemaCache.ttlMillis", 600_000L));
  }

  /** Read settings from a classpath properties resource. */
  public static ConnectionSettings load(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = ConnectionSettings.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Settings resource not found: " + resource);
      p.load(in);
    } catch (IOException e) {
      throw new IllegalArgumentException("Failed to read settings resource " + resource, e);
    }
    return fromProperties(p);
  }

  private static int intProp(Properties p, String key, int dflt) {
    return (int) longProp(p, key, dflt);
  }

  private static long longProp(Properties p, String key, long dflt) {
    String v = p.getProperty(PREFIX + key);
    if (v == null || v.isBlank()) return dflt;
    try {
      return Long.parseLong(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid number for " + PREFIX + key + ": '" + v + "'", e);
    }
  }

  @Override
  public String toString() {
    // password omitted
    return "ConnectionSettings[url=" + url + ", username=" + username + ", maxPoolSize=" + maxPoolSize
        + ", dialect=" + dialect + ", evalThreads=" + evalThreads + "]";
  }
}
