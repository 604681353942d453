package io.intellixity.tessel.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcPoolTest {

  @Test
  void infersArrayElementTypes() {
    assertEquals("int4", JdbcPool.inferElementType(new Object[]{1, 2}));
    assertEquals("int8", JdbcPool.inferElementType(new Object[]{1, 2L}));
    assertEquals("numeric", JdbcPool.inferElementType(new Object[]{1, new BigDecimal("1.5")}));
    assertEquals("uuid", JdbcPool.inferElementType(new Object[]{UUID.randomUUID(), null}));
    assertEquals("text", JdbcPool.inferElementType(new Object[]{1, "a"}));
    assertEquals("text", JdbcPool.inferElementType(new Object[]{}));
  }

  @Test
  void bigNumericTypesReadAsText() {
    assertTrue(JdbcPool.readsAsText("int8"));
    assertTrue(JdbcPool.readsAsText("NUMERIC"));
    assertFalse(JdbcPool.readsAsText("int4"));
    assertFalse(JdbcPool.readsAsText(null));
  }

  @Test
  void connectionFailureFailsTheFuture() {
    SQLException refused = new SQLException("connection refused", "08001");
    JdbcPool pool = new JdbcPool("test", new FailingDataSource(refused), Runnable::run, new ObjectMapper());

    CompletableFuture<?> f = pool.execute("SELECT 1 WHERE $1=1", List.of(1));

    CompletionException ex = assertThrows(CompletionException.class, f::join);
    JdbcExecutionException failure = assertInstanceOf(JdbcExecutionException.class, ex.getCause());
    assertSame(refused, failure.getCause());
    assertEquals("08001", failure.sqlState());
    assertEquals("Statement failed on pool test: connection refused", failure.getMessage());
  }

  private static final class FailingDataSource implements DataSource {
    private final SQLException failure;

    FailingDataSource(SQLException failure) {
      this.failure = failure;
    }

    @Override public Connection getConnection() throws SQLException { throw failure; }
    @Override public Connection getConnection(String username, String password) throws SQLException { throw failure; }
    @Override public PrintWriter getLogWriter() { return null; }
    @Override public void setLogWriter(PrintWriter out) {}
    @Override public void setLoginTimeout(int seconds) {}
    @Override public int getLoginTimeout() { return 0; }
    @Override public Logger getParentLogger() { return Logger.getGlobal(); }
    @Override public <T> T unwrap(Class<T> iface) throws SQLException { throw new SQLException("not a wrapper"); }
    @Override public boolean isWrapperFor(Class<?> iface) { return false; }
  }
}
