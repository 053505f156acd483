package io.intellixity.reportql.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Compiled statement: SQL text with positional placeholders plus the ordered parameter values.
 * <p>
 * The SQL never contains a caller-supplied value. Parameters may contain nulls, so the list is not a {@code List.of}.
 */
public record CompiledQuery(String sql, List<Object> params, String sourceKey) {
  public CompiledQuery {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(sourceKey, "sourceKey");
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }
}
