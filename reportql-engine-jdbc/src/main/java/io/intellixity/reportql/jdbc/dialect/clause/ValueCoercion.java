package io.intellixity.reportql.jdbc.dialect.clause;

import io.intellixity.reportql.catalog.FieldDefinition;
import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.QueryValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Converts decoded JSON scalars into driver-friendly values for the field's semantic type.
 * <p>
 * number: {@link Number} kept, numeric text to {@link BigDecimal}.
 * date: ISO {@code yyyy-MM-dd} to {@link LocalDate}, ISO date-time to {@link LocalDateTime}.
 * boolean: {@link Boolean} kept, {@code "true"/"false"} parsed.
 * string: numbers and booleans are rendered as text.
 */
final class ValueCoercion {
  private ValueCoercion() {}

  static boolean isScalar(Object v) {
    return v != null && !(v instanceof Collection<?>) && !(v instanceof Map<?, ?>) && !v.getClass().isArray();
  }

  static Object coerce(FieldDefinition fd, Object v, String operator) {
    if (!isScalar(v)) throw malformed(fd, operator, "expected a scalar value");
    return switch (fd.type()) {
      case STRING -> (v instanceof String) ? v : String.valueOf(v);
      case NUMBER -> toNumber(fd, v, operator);
      case DATE -> toDate(fd, v, operator);
      case BOOLEAN -> toBoolean(fd, v, operator);
    };
  }

  private static Object toNumber(FieldDefinition fd, Object v, String operator) {
    if (v instanceof Number) return v;
    if (v instanceof String s) {
      try {
        return new BigDecimal(s.trim());
      } catch (NumberFormatException e) {
        throw malformed(fd, operator, "'" + s + "' is not a number");
      }
    }
    throw malformed(fd, operator, "expected a number");
  }

  private static Object toDate(FieldDefinition fd, Object v, String operator) {
    if (v instanceof LocalDate || v instanceof LocalDateTime) return v;
    if (v instanceof String s) {
      String t = s.trim();
      try {
        return (t.length() > 10) ? LocalDateTime.parse(t) : LocalDate.parse(t);
      } catch (DateTimeParseException e) {
        throw malformed(fd, operator, "'" + s + "' is not an ISO date");
      }
    }
    throw malformed(fd, operator, "expected an ISO date string");
  }

  private static Object toBoolean(FieldDefinition fd, Object v, String operator) {
    if (v instanceof Boolean) return v;
    if (v instanceof String s) {
      String t = s.trim().toLowerCase(Locale.ROOT);
      if (t.equals("true")) return Boolean.TRUE;
      if (t.equals("false")) return Boolean.FALSE;
    }
    throw malformed(fd, operator, "expected true or false");
  }

  static QueryValidationException malformed(FieldDefinition fd, String operator, String detail) {
    return new QueryValidationException(ErrorKind.MALFORMED_CONDITION_VALUE, fd.name(),
        operator + " on '" + fd.name() + "': " + detail);
  }
}
