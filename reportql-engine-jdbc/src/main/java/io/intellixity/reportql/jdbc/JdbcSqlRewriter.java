package io.intellixity.reportql.jdbc;

import java.util.Arrays;

/**
 * Rewrites numbered placeholders ({@code $1}, {@code $2}, ...) into JDBC {@code ?} binds.
 *
 * Rules:
 * - a placeholder is '$' followed by one or more digits
 * - text inside single quotes is copied untouched ('' is an escaped quote)
 * - text inside double-quoted identifiers is copied untouched
 *
 * {@link Rewritten#order()} maps the i-th '?' to the 0-based index of the parameter it binds.
 */
public final class JdbcSqlRewriter {
  private JdbcSqlRewriter() {}

  public record Rewritten(String sql, int[] order) {}

  public static Rewritten rewrite(String sql) {
    if (sql == null) return new Rewritten("", new int[0]);
    StringBuilder out = new StringBuilder(sql.length());
    int[] order = new int[8];
    int count = 0;
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        // '' escape
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }

      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }

      if (!inSingleQuote && !inDoubleQuote && ch == '$' && i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int n = Integer.parseInt(sql.substring(i + 1, end));
        if (n < 1) throw new IllegalArgumentException("Placeholder index must be >= 1: $" + n);
        if (count == order.length) order = Arrays.copyOf(order, count * 2);
        order[count++] = n - 1;
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    return new Rewritten(out.toString(), Arrays.copyOf(order, count));
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
