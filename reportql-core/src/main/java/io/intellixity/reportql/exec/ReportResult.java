package io.intellixity.reportql.exec;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.reportql.query.ErrorKind;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one report execution. Failures carry no rows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReportResult(boolean success,
                           ReportStatus status,
                           List<Map<String, Object>> data,
                           Integer rowCount,
                           Long executionTimeMs,
                           String error,
                           ErrorKind errorKind,
                           QueryEcho query) {

  public static ReportResult succeeded(List<Map<String, Object>> rows, long elapsedMs, QueryEcho echo) {
    List<Map<String, Object>> data = (rows == null) ? List.of() : rows;
    return new ReportResult(true, ReportStatus.SUCCEEDED, data, data.size(), elapsedMs, null, null, echo);
  }

  public static ReportResult failed(ErrorKind kind, String message, QueryEcho echo) {
    ReportStatus st = (kind == ErrorKind.TIMEOUT) ? ReportStatus.TIMED_OUT : ReportStatus.FAILED;
    return new ReportResult(false, st, null, null, null, message, kind, echo);
  }
}
