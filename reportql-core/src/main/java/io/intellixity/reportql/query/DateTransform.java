package io.intellixity.reportql.query;

import java.util.Locale;

/** Date bucketing granularities. Only legal on date fields. */
public enum DateTransform {
  YEAR, QUARTER, MONTH, WEEK, DAY;

  /** Lower-case spelling used in default aliases and the catalog. */
  public String token() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static DateTransform fromToken(String raw) {
    if (raw == null) return null;
    String t = raw.trim().toUpperCase(Locale.ROOT);
    for (DateTransform d : values()) {
      if (d.name().equals(t)) return d;
    }
    return null;
  }
}
