package io.intellixity.reportql.query;

import java.util.Objects;

public record Metric(String field, String aggregation, String alias) {
  public Metric {
    Objects.requireNonNull(field, "field");
  }

  public Metric(String field, String aggregation) {
    this(field, aggregation, null);
  }
}
