package io.intellixity.reportql.query;

import java.util.Objects;

/**
 * How an aggregation wraps its column.
 * <p>
 * {@link Simple} renders {@code NAME(col)}; {@link FieldEmbedded} substitutes the column into a pattern
 * whose single {@code %s} marks the column position (e.g. {@code COUNT(DISTINCT %s)}).
 */
public sealed interface AggregationTemplate permits AggregationTemplate.Simple, AggregationTemplate.FieldEmbedded {

  record Simple(String function) implements AggregationTemplate {
    public Simple {
      Objects.requireNonNull(function, "function");
    }
  }

  record FieldEmbedded(String pattern) implements AggregationTemplate {
    public FieldEmbedded {
      Objects.requireNonNull(pattern, "pattern");
      if (!pattern.contains("%s")) throw new IllegalArgumentException("pattern must contain %s: " + pattern);
    }
  }
}
