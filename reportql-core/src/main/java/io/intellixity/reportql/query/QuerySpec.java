package io.intellixity.reportql.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.reportql.query.json.QuerySpecJsonDeserializer;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative report request: which source, which dimensions and metrics, filters, ordering and row limit.
 * <p>
 * Tokens are kept exactly as the caller sent them; canonicalization happens during validation.
 * A null {@code limit} means "use the engine maximum".
 */
@JsonDeserialize(using = QuerySpecJsonDeserializer.class)
public record QuerySpec(String source,
                        List<Dimension> dimensions,
                        List<Metric> metrics,
                        FilterGroup filters,
                        List<OrderField> orderBy,
                        Integer limit) {
  public QuerySpec {
    dimensions = (dimensions == null) ? List.of() : List.copyOf(dimensions);
    metrics = (metrics == null) ? List.of() : List.copyOf(metrics);
    filters = (filters == null) ? new FilterGroup(Clause.AND, List.of()) : filters;
    orderBy = (orderBy == null) ? List.of() : List.copyOf(orderBy);
  }

  public boolean hasProjection() {
    return !dimensions.isEmpty() || !metrics.isEmpty();
  }

  public QuerySpec withLimit(Integer newLimit) {
    return new QuerySpec(source, dimensions, metrics, filters, orderBy, newLimit);
  }

  public static Builder builder(String source) {
    return new Builder(source);
  }

  /** Fluent builder, mostly for programmatic callers and tests. */
  public static final class Builder {
    private final String source;
    private final ArrayList<Dimension> dimensions = new ArrayList<>();
    private final ArrayList<Metric> metrics = new ArrayList<>();
    private final ArrayList<Condition> conditions = new ArrayList<>();
    private Clause clause = Clause.AND;
    private final ArrayList<OrderField> orderBy = new ArrayList<>();
    private Integer limit;

    private Builder(String source) {
      this.source = source;
    }

    public Builder dimension(String field) { dimensions.add(new Dimension(field)); return this; }
    public Builder dimension(String field, String transform, String alias) {
      dimensions.add(new Dimension(field, transform, alias));
      return this;
    }
    public Builder metric(String field, String aggregation) { metrics.add(new Metric(field, aggregation)); return this; }
    public Builder metric(String field, String aggregation, String alias) {
      metrics.add(new Metric(field, aggregation, alias));
      return this;
    }
    public Builder where(String field, String operator, Object value) {
      conditions.add(new Condition(field, operator, value));
      return this;
    }
    public Builder clause(Clause c) { this.clause = c; return this; }
    public Builder orderBy(String field, OrderField.Direction direction) {
      orderBy.add(new OrderField(field, direction));
      return this;
    }
    public Builder limit(Integer limit) { this.limit = limit; return this; }

    public QuerySpec build() {
      return new QuerySpec(source, dimensions, metrics, new FilterGroup(clause, conditions), orderBy, limit);
    }
  }
}
