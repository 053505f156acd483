package io.intellixity.reportql.spi.sql;

import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.exec.CompiledQuery;
import io.intellixity.reportql.query.QuerySpec;

/**
 * Backend SPI: compiles a validated source + spec into a parameterized statement.
 * <p>
 * Implementations validate every field, operator, aggregation and transform they render and throw
 * {@link io.intellixity.reportql.query.QueryValidationException} on the first violation.
 * {@code limit} is already clamped by the engine.
 */
public interface ReportDialect {
  String id();

  CompiledQuery compile(SourceDefinition source, QuerySpec spec, int limit);
}
