package io.intellixity.reportql.server.web;

import io.intellixity.reportql.catalog.ReportCatalog;
import io.intellixity.reportql.exec.ReportResult;
import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.QuerySpec;
import io.intellixity.reportql.server.service.ReportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/custom-reports")
public final class CustomReportController {
  private final ReportService reports;

  public CustomReportController(ReportService reports) {
    this.reports = reports;
  }

  @GetMapping("/fields")
  public ApiResponse<ReportCatalog.Descriptor> fields() {
    return ApiResponse.ok(reports.fields());
  }

  @GetMapping("/sources")
  public ApiResponse<List<ReportCatalog.SourceSummary>> sources() {
    return ApiResponse.ok(reports.sources());
  }

  @PostMapping("/execute")
  public ResponseEntity<ReportResult> execute(@RequestBody(required = false) QuerySpec spec) {
    return respond(reports.execute(spec));
  }

  /** Same as execute with the row limit forced to the preview size. */
  @PostMapping("/preview")
  public ResponseEntity<ReportResult> preview(@RequestBody(required = false) QuerySpec spec) {
    return respond(reports.preview(spec));
  }

  static HttpStatus statusOf(ReportResult r) {
    if (r.success()) return HttpStatus.OK;
    ErrorKind k = r.errorKind();
    if (k == ErrorKind.TIMEOUT) return HttpStatus.GATEWAY_TIMEOUT;
    if (k == ErrorKind.EXECUTION_ERROR) return HttpStatus.BAD_GATEWAY;
    return HttpStatus.BAD_REQUEST;
  }

  private static ResponseEntity<ReportResult> respond(ReportResult r) {
    return ResponseEntity.status(statusOf(r)).body(r);
  }
}
