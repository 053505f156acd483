package io.intellixity.reportql.query;

import java.util.List;

/** Flat list of conditions joined by one logical connective. */
public record FilterGroup(Clause clause, List<Condition> conditions) {
  public FilterGroup {
    clause = (clause == null) ? Clause.AND : clause;
    conditions = (conditions == null) ? List.of() : List.copyOf(conditions);
  }

  public static FilterGroup and(Condition... conditions) {
    return new FilterGroup(Clause.AND, List.of(conditions));
  }

  public boolean isEmpty() {
    return conditions.isEmpty();
  }
}
