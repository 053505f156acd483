package io.intellixity.reportql.spi.exec;

import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.catalog.SourceRegistry;
import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.QuerySpec;
import io.intellixity.reportql.query.QueryValidationException;

import java.util.Objects;

/**
 * Validates:
 * - source is present and registered
 * - at least one dimension or metric
 *
 * Field-level checks are left to the dialect's clause builders.
 */
public final class DefaultSpecValidationStrategy implements SpecValidationStrategy {
  @Override
  public SourceDefinition validate(QuerySpec spec, SourceRegistry registry) {
    Objects.requireNonNull(registry, "registry");
    if (spec == null || spec.source() == null || spec.source().isBlank()) {
      throw new QueryValidationException(ErrorKind.UNKNOWN_SOURCE, null, "Data source is required");
    }
    SourceDefinition source = registry.getSource(spec.source());
    if (!spec.hasProjection()) {
      throw new QueryValidationException(ErrorKind.EMPTY_PROJECTION, null,
          "At least one dimension or metric is required");
    }
    return source;
  }
}
