package io.intellixity.reportql.catalog;

import java.util.Objects;

/** A whitelisted column of one source. {@code name} is also the physical column name. */
public record FieldDefinition(String name, FieldType type, String label, String category) {
  public static final String DEFAULT_CATEGORY = "Other";

  public FieldDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    label = (label == null || label.isBlank()) ? name : label;
    category = (category == null || category.isBlank()) ? DEFAULT_CATEGORY : category;
  }
}
