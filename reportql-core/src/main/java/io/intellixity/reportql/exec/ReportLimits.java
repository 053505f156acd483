package io.intellixity.reportql.exec;

import java.time.Duration;
import java.util.Objects;

/** Row ceilings and the wall-clock execution timeout. */
public record ReportLimits(int maxRows, Duration timeout, int previewRows) {
  public static final int DEFAULT_MAX_ROWS = 10_000;
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  public static final int DEFAULT_PREVIEW_ROWS = 100;

  public ReportLimits {
    Objects.requireNonNull(timeout, "timeout");
    if (maxRows <= 0) throw new IllegalArgumentException("maxRows must be positive: " + maxRows);
    if (previewRows <= 0) throw new IllegalArgumentException("previewRows must be positive: " + previewRows);
    if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be positive: " + timeout);
  }

  public static ReportLimits defaults() {
    return new ReportLimits(DEFAULT_MAX_ROWS, DEFAULT_TIMEOUT, DEFAULT_PREVIEW_ROWS);
  }

  /** {@code min(requested, maxRows)}; an absent or non-positive request gets {@code maxRows}. */
  public int effectiveLimit(Integer requested) {
    if (requested == null || requested <= 0) return maxRows;
    return Math.min(requested, maxRows);
  }
}
