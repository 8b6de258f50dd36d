package io.intellixity.reltab.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.reltab.jdbc.dialect.SqlDialect;
import io.intellixity.reltab.jdbc.dialect.SqlDialects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Builds pooled {@link JdbcConnection}s from {@link ConnectionSettings}. */
public final class JdbcConnections {
  private static final Logger log = LoggerFactory.getLogger(JdbcConnections.class);

  private JdbcConnections() {}

  /**
   * Open a connection backed by a Hikari pool and a fixed evaluation thread pool. Both are released by
   * {@link JdbcConnection#close()}.
   */
  public static JdbcConnection open(ConnectionSettings settings) {
    Objects.requireNonNull(settings, "settings");
    SqlDialect dialect = SqlDialects.forId(settings.dialect());

    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(settings.url());
    hc.setUsername(settings.username());
    hc.setPassword(settings.password());
    hc.setMaximumPoolSize(settings.maxPoolSize());
    hc.setPoolName("reltab-" + dialect.id());
    HikariDataSource ds = new HikariDataSource(hc);

    ExecutorService executor = Executors.newFixedThreadPool(settings.evalThreads(), evalThreads());
    log.info("reltab.jdbc open dialect={} maxPoolSize={} evalThreads={} url={}",
        dialect.id(), settings.maxPoolSize(), settings.evalThreads(), settings.url());

    TableSchemaCache cache = new TableSchemaCache(settings.schemaCacheMaxEntries(), settings.schemaCacheTtlMillis());
    return new JdbcConnection(ds, dialect, executor, cache, List.<AutoCloseable>of(executor::shutdown, ds));
  }

  private static ThreadFactory evalThreads() {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "reltab-eval-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
