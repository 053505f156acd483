package io.intellixity.reportql.server.service;

import io.intellixity.reportql.catalog.ReportCatalog;
import io.intellixity.reportql.exec.ReportEngine;
import io.intellixity.reportql.exec.ReportResult;
import io.intellixity.reportql.query.QuerySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public final class ReportService {
  private static final Logger log = LoggerFactory.getLogger(ReportService.class);

  private final ReportEngine engine;
  private final ReportCatalog catalog;

  public ReportService(ReportEngine engine, ReportCatalog catalog) {
    this.engine = engine;
    this.catalog = catalog;
  }

  public ReportCatalog.Descriptor fields() {
    return catalog.describe();
  }

  public List<ReportCatalog.SourceSummary> sources() {
    return catalog.summaries();
  }

  public ReportResult execute(QuerySpec spec) {
    ReportResult r = engine.execute(spec);
    logOutcome("execute", spec, r);
    return r;
  }

  public ReportResult preview(QuerySpec spec) {
    ReportResult r = engine.preview(spec);
    logOutcome("preview", spec, r);
    return r;
  }

  private static void logOutcome(String op, QuerySpec spec, ReportResult r) {
    if (!log.isInfoEnabled()) return;
    String source = (spec == null) ? null : spec.source();
    if (r.success()) {
      log.info("reportql.report op={} source={} rows={} ms={}", op, source, r.rowCount(), r.executionTimeMs());
    } else {
      log.info("reportql.report op={} source={} status={} kind={}", op, source, r.status(), r.errorKind());
    }
  }
}
