package io.intellixity.tessel.persistence.jdbc;

import java.sql.SQLException;

/** A statement failed inside the driver. Carries the five-character Postgres SQLSTATE when the driver reported one. */
public final class JdbcExecutionException extends RuntimeException {
  private final String sqlState;

  public JdbcExecutionException(String message, SQLException cause) {
    super(message, cause);
    this.sqlState = cause.getSQLState();
  }

  /** Null when the failure happened before the server answered. */
  public String sqlState() { return sqlState; }
}
