package io.intellixity.reportql.validate;

import io.intellixity.reportql.catalog.FieldDefinition;
import io.intellixity.reportql.catalog.FieldType;
import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.catalog.SourceRegistry;
import io.intellixity.reportql.query.Aggregation;
import io.intellixity.reportql.query.DateTransform;
import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.Operator;
import io.intellixity.reportql.query.QueryValidationException;

/**
 * Stateless whitelist checks. Each returns the canonical value or throws {@link QueryValidationException}.
 * <p>
 * Nothing that fails these checks ever reaches SQL text.
 */
public final class Whitelists {
  private Whitelists() {}

  public static FieldDefinition validateField(SourceRegistry registry, String sourceKey, String fieldName) {
    return validateField(registry.getSource(sourceKey), fieldName);
  }

  public static FieldDefinition validateField(SourceDefinition source, String fieldName) {
    FieldDefinition fd = source.field(fieldName);
    if (fd == null) {
      throw new QueryValidationException(ErrorKind.UNKNOWN_FIELD, fieldName,
          "Field '" + fieldName + "' is not allowed for source '" + source.key() + "'");
    }
    return fd;
  }

  public static Operator validateOperator(String token) {
    Operator op = Operator.fromToken(token);
    if (op == null) {
      throw new QueryValidationException(ErrorKind.UNSUPPORTED_OPERATOR, token, "Operator '" + token + "' not allowed");
    }
    return op;
  }

  public static Aggregation validateAggregation(String token) {
    Aggregation a = Aggregation.fromToken(token);
    if (a == null) {
      throw new QueryValidationException(ErrorKind.UNSUPPORTED_AGGREGATION, token,
          "Aggregation '" + token + "' not allowed");
    }
    return a;
  }

  /** Transforms bucket dates; any other field type is rejected even for a known granularity. */
  public static DateTransform validateDateTransform(String token, FieldDefinition field) {
    DateTransform dt = DateTransform.fromToken(token);
    if (dt == null) {
      throw new QueryValidationException(ErrorKind.UNSUPPORTED_TRANSFORM, token,
          "Date transform '" + token + "' not allowed");
    }
    if (field.type() != FieldType.DATE) {
      throw new QueryValidationException(ErrorKind.UNSUPPORTED_TRANSFORM, token,
          "Date transform '" + token + "' requires a date field, '" + field.name() + "' is " + field.type().token());
    }
    return dt;
  }

  /** Aliases are spliced into SQL, so they are restricted to plain identifiers. */
  public static String validateIdentifier(String token, String usage) {
    if (!Identifiers.isIdentifier(token)) {
      throw new QueryValidationException(ErrorKind.INVALID_IDENTIFIER, token,
          "Invalid " + usage + " '" + token + "': expected letters, digits and underscores");
    }
    return token;
  }

  /**
   * Order-by tokens may name a projected alias, so they are not checked against the field whitelist.
   * They are still restricted to {@code [A-Za-z0-9_]+}.
   */
  public static String validateOrderToken(String token) {
    if (!Identifiers.isWord(token)) {
      throw new QueryValidationException(ErrorKind.INVALID_IDENTIFIER, token,
          "Invalid orderBy field '" + token + "': expected letters, digits and underscores");
    }
    return token;
  }
}
