package io.intellixity.reportql.jdbc.dialect.clause;

import io.intellixity.reportql.catalog.FieldDefinition;
import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.query.Clause;
import io.intellixity.reportql.query.Condition;
import io.intellixity.reportql.query.FilterGroup;
import io.intellixity.reportql.query.Operator;
import io.intellixity.reportql.validate.Whitelists;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * WHERE body for a flat filter group. Every value goes through the cursor; none is ever written into the text.
 * Returns "" when there are no conditions.
 */
public final class PredicateClauseBuilder {

  public String build(SourceDefinition source, FilterGroup filters, ParamCursor cursor) {
    if (filters == null || filters.isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (Condition c : filters.conditions()) {
      parts.add(condition(source, c, cursor));
    }
    String sep = (filters.clause() == Clause.OR) ? " OR " : " AND ";
    return String.join(sep, parts);
  }

  private static String condition(SourceDefinition source, Condition c, ParamCursor cursor) {
    FieldDefinition fd = Whitelists.validateField(source, c.field());
    Operator op = Whitelists.validateOperator(c.operator());
    String col = fd.name();
    Object value = c.value();

    return switch (op.arity()) {
      case NONE -> col + " " + op.token();
      case LIST -> listSql(fd, op, value, cursor);
      case PAIR -> betweenSql(fd, op, value, cursor);
      case PATTERN -> {
        if (!ValueCoercion.isScalar(value)) throw ValueCoercion.malformed(fd, op.token(), "expected a scalar pattern");
        yield col + " " + op.token() + " " + cursor.bind("%" + value + "%");
      }
      case SCALAR -> {
        if (value == null) throw ValueCoercion.malformed(fd, op.token(), "value is required");
        yield col + " " + op.token() + " " + cursor.bind(ValueCoercion.coerce(fd, value, op.token()));
      }
    };
  }

  private static String listSql(FieldDefinition fd, Operator op, Object value, ParamCursor cursor) {
    List<Object> vals = elements(fd, op, value);
    if (vals.isEmpty()) throw ValueCoercion.malformed(fd, op.token(), "requires a non-empty array value");
    Class<?> kind = null;
    List<String> ph = new ArrayList<>(vals.size());
    for (Object v : vals) {
      if (!ValueCoercion.isScalar(v)) throw ValueCoercion.malformed(fd, op.token(), "array elements must be scalars");
      Class<?> k = scalarKind(v);
      if (kind == null) kind = k;
      else if (kind != k) throw ValueCoercion.malformed(fd, op.token(), "array elements must share one type");
      ph.add(cursor.bind(ValueCoercion.coerce(fd, v, op.token())));
    }
    return fd.name() + " " + op.token() + " (" + String.join(", ", ph) + ")";
  }

  private static String betweenSql(FieldDefinition fd, Operator op, Object value, ParamCursor cursor) {
    List<Object> vals = elements(fd, op, value);
    if (vals.size() != 2) {
      throw ValueCoercion.malformed(fd, op.token(), "requires an array of exactly two values, got " + vals.size());
    }
    String lo = cursor.bind(ValueCoercion.coerce(fd, vals.get(0), op.token()));
    String hi = cursor.bind(ValueCoercion.coerce(fd, vals.get(1), op.token()));
    return fd.name() + " BETWEEN " + lo + " AND " + hi;
  }

  private static List<Object> elements(FieldDefinition fd, Operator op, Object value) {
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    if (value instanceof Object[] arr) return Arrays.asList(arr);
    throw ValueCoercion.malformed(fd, op.token(), "requires an array value");
  }

  private static Class<?> scalarKind(Object v) {
    if (v instanceof Number) return Number.class;
    if (v instanceof Boolean) return Boolean.class;
    return String.class;
  }
}
