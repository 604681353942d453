package io.intellixity.tessel.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Builds the primary and optional read-only Hikari pools from {@link JdbcPoolSettings}. */
public final class JdbcPools {
  private static final Logger log = LoggerFactory.getLogger(JdbcPools.class);

  private JdbcPools() {}

  /**
   * Both pools plus the executor their JDBC work runs on. {@link #readonly()} is null when no read-only URL is
   * configured.
   */
  public record PoolPair(JdbcPool primary, JdbcPool readonly, List<HikariDataSource> dataSources,
                         ExecutorService executor) implements AutoCloseable {
    @Override
    public void close() {
      executor.shutdown();
      for (HikariDataSource ds : dataSources) ds.close();
      log.info("tessel.jdbc pools_closed count={}", dataSources.size());
    }
  }

  public static PoolPair create(JdbcPoolSettings settings) {
    return create(settings, new ObjectMapper());
  }

  public static PoolPair create(JdbcPoolSettings settings, ObjectMapper json) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(json, "json");

    int threads = settings.maximumPoolSize() * (settings.hasReadOnly() ? 2 : 1);
    ExecutorService executor = Executors.newFixedThreadPool(threads, daemonThreads());
    List<HikariDataSource> dataSources = new ArrayList<>(2);
    try {
      HikariDataSource rw = new HikariDataSource(config(settings, settings.jdbcUrl(), false));
      dataSources.add(rw);
      JdbcPool primary = new JdbcPool(rw.getPoolName(), rw, executor, json);

      JdbcPool readonly = null;
      if (settings.hasReadOnly()) {
        HikariDataSource ro = new HikariDataSource(config(settings, settings.readOnlyJdbcUrl(), true));
        dataSources.add(ro);
        readonly = new JdbcPool(ro.getPoolName(), ro, executor, json);
      }
      log.info("tessel.jdbc pools_created schema={} readonly={} maximumPoolSize={}",
          settings.schema(), settings.hasReadOnly(), settings.maximumPoolSize());
      return new PoolPair(primary, readonly, List.copyOf(dataSources), executor);
    } catch (RuntimeException e) {
      for (HikariDataSource ds : dataSources) ds.close();
      executor.shutdown();
      throw e;
    }
  }

  static HikariConfig config(JdbcPoolSettings settings, String url, boolean readOnly) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName(readOnly ? "tessel-ro" : "tessel-rw");
    hc.setJdbcUrl(url);
    hc.setUsername(settings.username());
    hc.setPassword(settings.password());
    hc.setSchema(settings.schema());
    hc.setReadOnly(readOnly);
    hc.setMaximumPoolSize(settings.maximumPoolSize());
    return hc;
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "tessel-jdbc-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
