package io.intellixity.reportql.jdbc.dialect.clause;

import io.intellixity.reportql.catalog.FieldDefinition;
import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.jdbc.dialect.JdbcReportDialect;
import io.intellixity.reportql.query.DateTransform;
import io.intellixity.reportql.query.Dimension;
import io.intellixity.reportql.validate.Whitelists;

/**
 * Validates a dimension and renders its column expression.
 * <p>
 * Projection and group-by both call this on their own, so the two clauses always carry the same text.
 */
final class DimensionExpressions {
  private DimensionExpressions() {}

  record Rendered(String expression, String defaultAlias) {}

  static Rendered render(JdbcReportDialect dialect, SourceDefinition source, Dimension dim) {
    FieldDefinition fd = Whitelists.validateField(source, dim.field());
    if (dim.transform() == null || dim.transform().isBlank()) {
      return new Rendered(fd.name(), null);
    }
    DateTransform dt = Whitelists.validateDateTransform(dim.transform(), fd);
    return new Rendered(dialect.dateBucket(fd.name(), dt), fd.name() + "_" + dt.token());
  }
}
