package io.intellixity.reportql.query;

import java.util.Objects;

public record OrderField(String field, Direction direction) {
  public OrderField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public enum Direction {
    ASC, DESC;

    /** DESC only on an exact case-insensitive match; anything else sorts ascending. */
    public static Direction parse(String raw) {
      return "DESC".equalsIgnoreCase(raw) ? DESC : ASC;
    }
  }
}
