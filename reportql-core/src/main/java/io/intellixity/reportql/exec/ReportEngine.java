package io.intellixity.reportql.exec;

import io.intellixity.reportql.query.QuerySpec;

public interface ReportEngine {
  /**
   * Validate and compile without touching any store.
   *
   * @throws io.intellixity.reportql.query.QueryValidationException when the spec is rejected
   */
  CompiledQuery compile(QuerySpec spec);

  /** Compile, route and execute. Never throws: every failure is reported in the result. */
  ReportResult execute(QuerySpec spec);

  /** {@link #execute} with the row limit forced to the preview size. */
  ReportResult preview(QuerySpec spec);
}
