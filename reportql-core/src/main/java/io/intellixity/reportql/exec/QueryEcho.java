package io.intellixity.reportql.exec;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic copy of a compiled statement. Not re-executable input.
 * <p>
 * {@code params} entries read {@code "$n: value"}; text-like values are single-quoted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryEcho(String source, String sql, List<String> params) {

  public static QueryEcho of(CompiledQuery q) {
    if (q == null) return null;
    List<String> ps = new ArrayList<>(q.params().size());
    int i = 1;
    for (Object v : q.params()) {
      ps.add("$" + (i++) + ": " + describe(v));
    }
    return new QueryEcho(q.sourceKey(), normalize(q.sql()), ps);
  }

  /** Echo for requests that failed before a statement existed. */
  public static QueryEcho sourceOnly(String source) {
    return new QueryEcho(source, null, null);
  }

  static String normalize(String sql) {
    return (sql == null) ? null : sql.replaceAll("\\s+", " ").trim();
  }

  private static String describe(Object v) {
    if (v == null) return "null";
    if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
    return "'" + v + "'";
  }
}
