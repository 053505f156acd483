package io.intellixity.reportql.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A queryable source: one table or view in one physical store, with its exhaustive field whitelist.
 * <p>
 * {@code fields} keeps declaration order (the catalog lists fields in that order).
 */
public record SourceDefinition(String key,
                               String table,
                               String storeId,
                               String label,
                               String description,
                               Map<String, FieldDefinition> fields) {
  public SourceDefinition {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(storeId, "storeId");
    label = (label == null || label.isBlank()) ? key : label;
    description = (description == null) ? "" : description;
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
  }

  /** Field by exact name, or null. */
  public FieldDefinition field(String name) {
    return (name == null) ? null : fields.get(name);
  }
}
