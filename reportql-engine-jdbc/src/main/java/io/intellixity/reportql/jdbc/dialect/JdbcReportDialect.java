package io.intellixity.reportql.jdbc.dialect;

import io.intellixity.reportql.query.DateTransform;
import io.intellixity.reportql.spi.sql.ReportDialect;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;

/** JDBC-family dialect: SQL text hooks used by the clause builders and the engine. */
public interface JdbcReportDialect extends ReportDialect {
  /** Placeholder text for the 1-based parameter {@code index}. */
  String placeholder(int index);

  /** Locale-stable bucketing expression for a date column. */
  String dateBucket(String column, DateTransform transform);

  /** Append the row ceiling. {@code limit} is engine-computed, never caller text. */
  String applyLimit(String sql, int limit);

  /** True when the driver reports a statement timeout or cancellation. */
  default boolean isTimeout(SQLException e) {
    return e instanceof SQLTimeoutException;
  }
}
