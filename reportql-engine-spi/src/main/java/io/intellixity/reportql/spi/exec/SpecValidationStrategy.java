package io.intellixity.reportql.spi.exec;

import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.catalog.SourceRegistry;
import io.intellixity.reportql.query.QuerySpec;

/**
 * Hook run before any clause is built. Returns the resolved source or throws
 * {@link io.intellixity.reportql.query.QueryValidationException}.
 * <p>
 * Applications may plug in stricter rules (e.g. per-caller source allow lists).
 */
public interface SpecValidationStrategy {
  SourceDefinition validate(QuerySpec spec, SourceRegistry registry);
}
