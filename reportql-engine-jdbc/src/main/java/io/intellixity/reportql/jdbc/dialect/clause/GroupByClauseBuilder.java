package io.intellixity.reportql.jdbc.dialect.clause;

import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.jdbc.dialect.JdbcReportDialect;
import io.intellixity.reportql.query.Dimension;
import io.intellixity.reportql.query.Metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** GROUP BY over the dimension expressions, only when the report aggregates. Returns "" otherwise. */
public final class GroupByClauseBuilder {
  private final JdbcReportDialect dialect;

  public GroupByClauseBuilder(JdbcReportDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public String build(SourceDefinition source, List<Dimension> dimensions, List<Metric> metrics) {
    if (metrics.isEmpty() || dimensions.isEmpty()) return "";
    List<String> exprs = new ArrayList<>();
    for (Dimension dim : dimensions) {
      exprs.add(DimensionExpressions.render(dialect, source, dim).expression());
    }
    return String.join(", ", exprs);
  }
}
