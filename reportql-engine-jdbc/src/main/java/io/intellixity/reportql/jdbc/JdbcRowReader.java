package io.intellixity.reportql.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result rows into maps keyed by column label, in select order. */
final class JdbcRowReader {
  private JdbcRowReader() {}

  static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 1; i <= n; i++) labels[i - 1] = md.getColumnLabel(i);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 1; i <= n; i++) {
        row.put(labels[i - 1], normalize(rs.getObject(i)));
      }
      out.add(row);
    }
    return out;
  }

  // java.sql temporal types -> java.time so rows serialize predictably.
  static Object normalize(Object v) {
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof java.sql.Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof java.sql.Time t) return t.toLocalTime();
    return v;
  }
}
