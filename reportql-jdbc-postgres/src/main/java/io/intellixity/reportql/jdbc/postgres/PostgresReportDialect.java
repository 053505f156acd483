package io.intellixity.reportql.jdbc.postgres;

import io.intellixity.reportql.jdbc.dialect.AbstractJdbcReportDialect;
import io.intellixity.reportql.query.DateTransform;
import org.postgresql.util.PSQLState;

import java.sql.SQLException;

/**
 * Postgres report dialect.
 *
 * Keeps only Postgres-specific overrides: {@code TO_CHAR} date buckets and timeout detection.
 * Generic clause rendering lives in {@link AbstractJdbcReportDialect}.
 */
public final class PostgresReportDialect extends AbstractJdbcReportDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public String dateBucket(String column, DateTransform transform) {
    return "TO_CHAR(" + column + ", '" + pattern(transform) + "')";
  }

  /** ISO week-year for weeks, so the first days of January land in the right week. */
  static String pattern(DateTransform transform) {
    return switch (transform) {
      case YEAR -> "YYYY";
      case QUARTER -> "YYYY-\"Q\"Q";
      case MONTH -> "YYYY-MM";
      case WEEK -> "IYYY-IW";
      case DAY -> "YYYY-MM-DD";
    };
  }

  /** 57014 is raised both for statement_timeout and for {@code Statement.cancel()}. */
  @Override
  public boolean isTimeout(SQLException e) {
    return super.isTimeout(e) || PSQLState.QUERY_CANCELED.getState().equals(e.getSQLState());
  }
}
