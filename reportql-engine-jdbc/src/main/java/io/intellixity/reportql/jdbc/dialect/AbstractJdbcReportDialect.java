package io.intellixity.reportql.jdbc.dialect;

import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.exec.CompiledQuery;
import io.intellixity.reportql.jdbc.dialect.clause.GroupByClauseBuilder;
import io.intellixity.reportql.jdbc.dialect.clause.OrderByClauseBuilder;
import io.intellixity.reportql.jdbc.dialect.clause.ParamCursor;
import io.intellixity.reportql.jdbc.dialect.clause.PredicateClauseBuilder;
import io.intellixity.reportql.jdbc.dialect.clause.ProjectionClauseBuilder;
import io.intellixity.reportql.query.QuerySpec;

import java.util.Objects;

/**
 * JDBC-generic report dialect base.
 *
 * Renders SELECT / WHERE / GROUP BY / ORDER BY through the clause builders in that order, sharing one
 * {@link ParamCursor}, then appends the row ceiling.
 *
 * DB-specific dialects override placeholders, date bucketing and limit syntax.
 */
public abstract class AbstractJdbcReportDialect implements JdbcReportDialect {
  private final ProjectionClauseBuilder projection = new ProjectionClauseBuilder(this);
  private final PredicateClauseBuilder predicate = new PredicateClauseBuilder();
  private final GroupByClauseBuilder groupBy = new GroupByClauseBuilder(this);
  private final OrderByClauseBuilder orderBy = new OrderByClauseBuilder();

  @Override
  public final CompiledQuery compile(SourceDefinition source, QuerySpec spec, int limit) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(spec, "spec");
    if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);

    ParamCursor cursor = new ParamCursor(this::placeholder);

    StringBuilder sql = new StringBuilder(128);
    sql.append("SELECT ").append(projection.build(source, spec.dimensions(), spec.metrics()));
    sql.append(" FROM ").append(source.table());

    String where = predicate.build(source, spec.filters(), cursor);
    if (!where.isEmpty()) sql.append(" WHERE ").append(where);

    String group = groupBy.build(source, spec.dimensions(), spec.metrics());
    if (!group.isEmpty()) sql.append(" GROUP BY ").append(group);

    String order = orderBy.build(spec.orderBy());
    if (!order.isEmpty()) sql.append(" ORDER BY ").append(order);

    return new CompiledQuery(applyLimit(sql.toString(), limit), cursor.params(), source.key());
  }

  /** Numbered {@code $n} by default; {@code JdbcSqlRewriter} maps them to JDBC {@code ?}. */
  @Override
  public String placeholder(int index) {
    return "$" + index;
  }

  /** ANSI-ish default; dialects without LIMIT override (MSSQL TOP, OFFSET/FETCH, etc.). */
  @Override
  public String applyLimit(String sql, int limit) {
    return sql + " LIMIT " + limit;
  }
}
