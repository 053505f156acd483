package io.intellixity.reportql.catalog;

import java.util.Collection;

/** Read-only catalog of the sources a report may target. */
public interface SourceRegistry {
  /**
   * @throws io.intellixity.reportql.query.QueryValidationException with
   *         {@link io.intellixity.reportql.query.ErrorKind#UNKNOWN_SOURCE} when no such source exists
   */
  SourceDefinition getSource(String key);

  /** All sources, in registration order. */
  Collection<SourceDefinition> allSources();
}
