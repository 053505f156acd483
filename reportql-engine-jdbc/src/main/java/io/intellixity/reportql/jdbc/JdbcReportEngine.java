package io.intellixity.reportql.jdbc;

import io.intellixity.reportql.catalog.SourceRegistry;
import io.intellixity.reportql.exec.CompiledQuery;
import io.intellixity.reportql.exec.QueryCancellation;
import io.intellixity.reportql.exec.ReportLimits;
import io.intellixity.reportql.exec.StoreExecutionException;
import io.intellixity.reportql.exec.handle.StoreHandleResolver;
import io.intellixity.reportql.jdbc.dialect.JdbcReportDialect;
import io.intellixity.reportql.spi.exec.AbstractReportEngine;
import io.intellixity.reportql.spi.exec.SpecValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Executes compiled reports over JDBC.
 * <p>
 * Each execution borrows a connection from the store's pool, binds parameters positionally, registers
 * {@link PreparedStatement#cancel()} with the engine's cancellation token and sets a driver-side query timeout
 * matching the engine timeout.
 */
public final class JdbcReportEngine extends AbstractReportEngine<JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcReportEngine.class);

  private final JdbcReportDialect dialect;
  private final int queryTimeoutSeconds;

  public JdbcReportEngine(JdbcReportDialect dialect,
                          SourceRegistry registry,
                          StoreHandleResolver<JdbcHandle> stores,
                          ReportLimits limits) {
    super(dialect, registry, stores, limits);
    this.dialect = dialect;
    this.queryTimeoutSeconds = timeoutSeconds(limits);
  }

  public JdbcReportEngine(JdbcReportDialect dialect,
                          SourceRegistry registry,
                          StoreHandleResolver<JdbcHandle> stores,
                          ReportLimits limits,
                          SpecValidationStrategy validation,
                          ExecutorService executor) {
    super(dialect, registry, stores, limits, validation, executor);
    this.dialect = dialect;
    this.queryTimeoutSeconds = timeoutSeconds(limits);
  }

  @Override
  protected List<Map<String, Object>> executeQuery(JdbcHandle handle, CompiledQuery query, QueryCancellation cancellation) {
    Objects.requireNonNull(handle, "handle");
    JdbcSqlRewriter.Rewritten jdbc = JdbcSqlRewriter.rewrite(query.sql());
    long start = System.nanoTime();
    debugSql(handle, query, jdbc);

    try (Connection c = handle.client().getConnection();
         PreparedStatement ps = c.prepareStatement(jdbc.sql())) {
      ps.setQueryTimeout(queryTimeoutSeconds);
      bindAll(ps, jdbc, query.params());
      cancellation.register(ps::cancel);
      try (ResultSet rs = ps.executeQuery()) {
        List<Map<String, Object>> rows = JdbcRowReader.readAll(rs);
        debugDone(query, rows.size(), System.nanoTime() - start);
        return rows;
      } finally {
        cancellation.clear();
      }
    } catch (SQLException e) {
      boolean timedOut = dialect.isTimeout(e) || cancellation.isCancelled();
      throw new StoreExecutionException(e.getMessage(), e, timedOut);
    }
  }

  private static void bindAll(PreparedStatement ps, JdbcSqlRewriter.Rewritten jdbc, List<Object> params) throws SQLException {
    int[] order = jdbc.order();
    for (int i = 0; i < order.length; i++) {
      int p = order[i];
      if (p >= params.size()) {
        throw new IllegalStateException("Placeholder $" + (p + 1) + " has no parameter (params=" + params.size() + ")");
      }
      ps.setObject(i + 1, params.get(p));
    }
  }

  private static int timeoutSeconds(ReportLimits limits) {
    long ms = limits.timeout().toMillis();
    return (int) Math.max(1, (ms + 999) / 1000);
  }

  private void debugSql(JdbcHandle h, CompiledQuery q, JdbcSqlRewriter.Rewritten jdbc) {
    if (!log.isDebugEnabled()) return;
    log.debug("reportql.jdbc op=SELECT source={} handleId={} dialect={} bindCount={} sql={}",
        q.sourceKey(), h.id(), dialect.id(), jdbc.order().length, jdbc.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : q.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("reportql.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(CompiledQuery q, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("reportql.jdbc_done op=SELECT source={} durationMs={} rows={}",
        q.sourceKey(), durationNanos / 1_000_000.0, rows);
  }
}
