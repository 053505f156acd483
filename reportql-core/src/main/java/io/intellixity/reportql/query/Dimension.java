package io.intellixity.reportql.query;

import java.util.Objects;

/** A grouping column, optionally bucketed by a date transform. Tokens are raw caller input. */
public record Dimension(String field, String transform, String alias) {
  public Dimension {
    Objects.requireNonNull(field, "field");
  }

  public Dimension(String field) {
    this(field, null, null);
  }
}
