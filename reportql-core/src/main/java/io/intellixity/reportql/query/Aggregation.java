package io.intellixity.reportql.query;

import java.util.Locale;

public enum Aggregation {
  COUNT(new AggregationTemplate.Simple("COUNT")),
  SUM(new AggregationTemplate.Simple("SUM")),
  AVG(new AggregationTemplate.Simple("AVG")),
  MIN(new AggregationTemplate.Simple("MIN")),
  MAX(new AggregationTemplate.Simple("MAX")),
  COUNT_DISTINCT(new AggregationTemplate.FieldEmbedded("COUNT(DISTINCT %s)"));

  private final AggregationTemplate template;

  Aggregation(AggregationTemplate template) {
    this.template = template;
  }

  public AggregationTemplate template() { return template; }

  /** Case-insensitive lookup; null when not one of the fixed aggregations. */
  public static Aggregation fromToken(String raw) {
    if (raw == null) return null;
    String t = raw.trim().toUpperCase(Locale.ROOT);
    for (Aggregation a : values()) {
      if (a.name().equals(t)) return a;
    }
    return null;
  }
}
