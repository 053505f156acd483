package io.intellixity.reportql.jdbc.dialect.clause;

import io.intellixity.reportql.query.OrderField;
import io.intellixity.reportql.validate.Whitelists;

import java.util.ArrayList;
import java.util.List;

/**
 * ORDER BY items. Tokens may be projected aliases, so there is no field-whitelist check here,
 * only the {@code [A-Za-z0-9_]+} charset rule.
 */
public final class OrderByClauseBuilder {

  public String build(List<OrderField> orderBy) {
    List<String> parts = new ArrayList<>();
    for (OrderField of : orderBy) {
      parts.add(Whitelists.validateOrderToken(of.field()) + " " + of.direction().name());
    }
    return String.join(", ", parts);
  }
}
