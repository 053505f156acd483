package io.intellixity.reportql.jdbc.dialect.clause;

import io.intellixity.reportql.catalog.FieldDefinition;
import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.jdbc.dialect.JdbcReportDialect;
import io.intellixity.reportql.query.Aggregation;
import io.intellixity.reportql.query.AggregationTemplate;
import io.intellixity.reportql.query.Dimension;
import io.intellixity.reportql.query.Metric;
import io.intellixity.reportql.validate.Whitelists;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * SELECT list: dimensions first, then metrics.
 * <p>
 * Default aliases: {@code <field>_<transform>} for bucketed dimensions, {@code <aggregation>_<field>} in lower
 * case for metrics. A plain dimension is aliased only when the caller asks for one.
 */
public final class ProjectionClauseBuilder {
  private final JdbcReportDialect dialect;

  public ProjectionClauseBuilder(JdbcReportDialect dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  public String build(SourceDefinition source, List<Dimension> dimensions, List<Metric> metrics) {
    List<String> items = new ArrayList<>();

    for (Dimension dim : dimensions) {
      DimensionExpressions.Rendered r = DimensionExpressions.render(dialect, source, dim);
      String alias = (dim.alias() != null) ? Whitelists.validateIdentifier(dim.alias(), "alias") : r.defaultAlias();
      items.add(alias == null ? r.expression() : r.expression() + " AS " + alias);
    }

    for (Metric m : metrics) {
      FieldDefinition fd = Whitelists.validateField(source, m.field());
      Aggregation agg = Whitelists.validateAggregation(m.aggregation());
      String alias = (m.alias() != null)
          ? Whitelists.validateIdentifier(m.alias(), "alias")
          : agg.name().toLowerCase(Locale.ROOT) + "_" + fd.name();
      items.add(aggregate(agg.template(), fd.name()) + " AS " + alias);
    }

    return String.join(", ", items);
  }

  static String aggregate(AggregationTemplate template, String column) {
    if (template instanceof AggregationTemplate.Simple s) {
      return s.function() + "(" + column + ")";
    }
    if (template instanceof AggregationTemplate.FieldEmbedded fe) {
      return String.format(Locale.ROOT, fe.pattern(), column);
    }
    throw new IllegalArgumentException("Unknown aggregation template: " + template);
  }
}
