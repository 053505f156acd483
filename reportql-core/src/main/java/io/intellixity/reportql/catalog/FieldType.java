package io.intellixity.reportql.catalog;

import com.fasterxml.jackson.annotation.JsonValue;
import io.intellixity.reportql.query.Aggregation;

import java.util.List;
import java.util.Locale;

/** Semantic type of a source field. */
public enum FieldType {
  STRING(List.of(Aggregation.COUNT, Aggregation.COUNT_DISTINCT)),
  NUMBER(List.of(Aggregation.COUNT, Aggregation.SUM, Aggregation.AVG, Aggregation.MIN, Aggregation.MAX)),
  DATE(List.of(Aggregation.COUNT, Aggregation.MIN, Aggregation.MAX)),
  BOOLEAN(List.of(Aggregation.COUNT, Aggregation.SUM));

  private final List<Aggregation> suggestedAggregations;

  FieldType(List<Aggregation> suggestedAggregations) {
    this.suggestedAggregations = suggestedAggregations;
  }

  /**
   * Aggregations offered to report-builder UIs for this type.
   * Not enforced at compile time: any aggregation is accepted on any field.
   */
  public List<Aggregation> suggestedAggregations() { return suggestedAggregations; }

  @JsonValue
  public String token() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static FieldType fromToken(String raw) {
    if (raw == null) return null;
    String t = raw.trim().toUpperCase(Locale.ROOT);
    for (FieldType ft : values()) {
      if (ft.name().equals(t)) return ft;
    }
    return null;
  }
}
