package io.intellixity.reportql.query;

import java.util.Objects;

/**
 * Single filter predicate.
 * <p>
 * {@code value} is the decoded JSON value: a scalar, a list (IN / NOT IN / BETWEEN) or null.
 */
public record Condition(String field, String operator, Object value) {
  public Condition {
    Objects.requireNonNull(field, "field");
  }
}
