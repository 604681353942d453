package io.intellixity.tessel.persistence.jdbc;

import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcPoolsTest {

  @Test
  void readOnlyConfigUsesReplicaUrl() {
    JdbcPoolSettings s = JdbcPoolSettings.load();

    HikariConfig rw = JdbcPools.config(s, s.jdbcUrl(), false);
    HikariConfig ro = JdbcPools.config(s, s.readOnlyJdbcUrl(), true);

    assertEquals("tessel-rw", rw.getPoolName());
    assertFalse(rw.isReadOnly());
    assertEquals("jdbc:postgresql://replica:5432/tessel", ro.getJdbcUrl());
    assertTrue(ro.isReadOnly());
    assertEquals("analytics", ro.getSchema());
    assertEquals(4, ro.getMaximumPoolSize());
  }
}
