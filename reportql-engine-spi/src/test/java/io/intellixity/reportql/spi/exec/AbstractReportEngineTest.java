package io.intellixity.reportql.spi.exec;

import io.intellixity.reportql.catalog.FieldDefinition;
import io.intellixity.reportql.catalog.FieldType;
import io.intellixity.reportql.catalog.InMemorySourceRegistry;
import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.exec.CompiledQuery;
import io.intellixity.reportql.exec.QueryCancellation;
import io.intellixity.reportql.exec.ReportLimits;
import io.intellixity.reportql.exec.ReportResult;
import io.intellixity.reportql.exec.ReportStatus;
import io.intellixity.reportql.exec.StoreExecutionException;
import io.intellixity.reportql.exec.handle.StoreHandle;
import io.intellixity.reportql.exec.handle.StoreHandleResolver;
import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.QuerySpec;
import io.intellixity.reportql.query.QueryValidationException;
import io.intellixity.reportql.spi.sql.ReportDialect;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractReportEngineTest {

  private record FakeHandle(String id) implements StoreHandle<Object> {
    @Override public Object client() { return new Object(); }
  }

  private static final class RecordingDialect implements ReportDialect {
    final List<Integer> limits = new ArrayList<>();

    @Override public String id() { return "fake"; }

    @Override
    public CompiledQuery compile(SourceDefinition source, QuerySpec spec, int limit) {
      limits.add(limit);
      if (!spec.dimensions().isEmpty() && source.field(spec.dimensions().get(0).field()) == null) {
        throw new QueryValidationException(ErrorKind.UNKNOWN_FIELD, spec.dimensions().get(0).field(), "unknown field");
      }
      return new CompiledQuery("SELECT state FROM " + source.table() + " WHERE state = $1 LIMIT " + limit,
          List.of("CA"), source.key());
    }
  }

  private static final class FakeEngine extends AbstractReportEngine<FakeHandle> {
    final AtomicInteger executions = new AtomicInteger();
    final List<String> handleIds = new ArrayList<>();
    final Function<QueryCancellation, List<Map<String, Object>>> body;

    FakeEngine(ReportDialect dialect, StoreHandleResolver<FakeHandle> stores, ReportLimits limits,
               Function<QueryCancellation, List<Map<String, Object>>> body) {
      super(dialect, AbstractReportEngineTest.registry(), stores, limits);
      this.body = body;
    }

    @Override
    protected List<Map<String, Object>> executeQuery(FakeHandle handle, CompiledQuery query, QueryCancellation cancellation) {
      executions.incrementAndGet();
      synchronized (handleIds) { handleIds.add(handle.id()); }
      return body.apply(cancellation);
    }
  }

  private static InMemorySourceRegistry registry() {
    Map<String, FieldDefinition> f = new LinkedHashMap<>();
    f.put("state", new FieldDefinition("state", FieldType.STRING, null, null));
    Map<String, FieldDefinition> d = new LinkedHashMap<>();
    d.put("deal_name", new FieldDefinition("deal_name", FieldType.STRING, null, null));
    return new InMemorySourceRegistry(List.of(
        new SourceDefinition("facilities", "snf_facilities", "market", null, null, f),
        new SourceDefinition("deals", "deals", "main", null, null, d),
        new SourceDefinition("orphan", "orphan", "nowhere", null, null, f)));
  }

  private static final class CountingResolver implements StoreHandleResolver<FakeHandle> {
    final AtomicInteger calls = new AtomicInteger();

    @Override
    public FakeHandle resolve(String storeId) {
      calls.incrementAndGet();
      if (!storeId.equals("market") && !storeId.equals("main")) {
        throw new IllegalArgumentException("Unknown store: " + storeId);
      }
      return new FakeHandle("pool:" + storeId);
    }
  }

  private static List<Map<String, Object>> oneRow() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("state", "CA");
    return List.of(row);
  }

  private static ReportLimits limits(Duration timeout) {
    return new ReportLimits(10_000, timeout, 100);
  }

  @Test
  void unknownSourceFailsWithoutRoutingOrExecuting() {
    CountingResolver stores = new CountingResolver();
    RecordingDialect dialect = new RecordingDialect();
    try (FakeEngine engine = new FakeEngine(dialect, stores, limits(Duration.ofSeconds(5)), c -> oneRow())) {
      ReportResult r = engine.execute(QuerySpec.builder("not_a_real_source").dimension("state").build());

      assertFalse(r.success());
      assertEquals(ReportStatus.FAILED, r.status());
      assertEquals(ErrorKind.UNKNOWN_SOURCE, r.errorKind());
      assertTrue(r.error().contains("not_a_real_source"));
      assertEquals("not_a_real_source", r.query().source());
      assertNull(r.query().sql());
      assertTrue(dialect.limits.isEmpty());
      assertEquals(0, stores.calls.get());
      assertEquals(0, engine.executions.get());
    }
  }

  @Test
  void emptyProjectionIsRejected() {
    CountingResolver stores = new CountingResolver();
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), stores, limits(Duration.ofSeconds(5)), c -> oneRow())) {
      ReportResult r = engine.execute(QuerySpec.builder("facilities").where("state", "=", "CA").build());
      assertEquals(ErrorKind.EMPTY_PROJECTION, r.errorKind());
      assertEquals(0, stores.calls.get());
    }
  }

  @Test
  void buildFailureNeverContactsTheStore() {
    CountingResolver stores = new CountingResolver();
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), stores, limits(Duration.ofSeconds(5)), c -> oneRow())) {
      ReportResult r = engine.execute(QuerySpec.builder("facilities").dimension("password").build());
      assertEquals(ErrorKind.UNKNOWN_FIELD, r.errorKind());
      assertEquals(0, stores.calls.get());
      assertEquals(0, engine.executions.get());
    }
  }

  @Test
  void successReturnsRowsAndEcho() {
    RecordingDialect dialect = new RecordingDialect();
    try (FakeEngine engine = new FakeEngine(dialect, new CountingResolver(), limits(Duration.ofSeconds(5)), c -> oneRow())) {
      ReportResult r = engine.execute(QuerySpec.builder("facilities").dimension("state").limit(10).build());

      assertTrue(r.success());
      assertEquals(ReportStatus.SUCCEEDED, r.status());
      assertEquals(1, r.rowCount());
      assertEquals("CA", r.data().get(0).get("state"));
      assertNotNull(r.executionTimeMs());
      assertEquals("SELECT state FROM snf_facilities WHERE state = $1 LIMIT 10", r.query().sql());
      assertEquals(List.of("$1: 'CA'"), r.query().params());
      assertEquals(List.of(10), dialect.limits);
    }
  }

  @Test
  void limitIsClampedBeforeBuilding() {
    RecordingDialect dialect = new RecordingDialect();
    try (FakeEngine engine = new FakeEngine(dialect, new CountingResolver(), limits(Duration.ofSeconds(5)), c -> oneRow())) {
      engine.execute(QuerySpec.builder("facilities").dimension("state").limit(50_000).build());
      engine.execute(QuerySpec.builder("facilities").dimension("state").build());
      engine.preview(QuerySpec.builder("facilities").dimension("state").limit(5_000).build());
      assertEquals(List.of(10_000, 10_000, 100), dialect.limits);
    }
  }

  @Test
  void routesBySourceStoreId() {
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), new CountingResolver(), limits(Duration.ofSeconds(5)), c -> oneRow())) {
      engine.execute(QuerySpec.builder("facilities").dimension("state").build());
      engine.execute(QuerySpec.builder("deals").dimension("deal_name").build());
      assertEquals(List.of("pool:market", "pool:main"), engine.handleIds);
    }
  }

  @Test
  void unknownStoreIsAnExecutionError() {
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), new CountingResolver(), limits(Duration.ofSeconds(5)), c -> oneRow())) {
      ReportResult r = engine.execute(QuerySpec.builder("orphan").dimension("state").build());
      assertEquals(ErrorKind.EXECUTION_ERROR, r.errorKind());
      assertTrue(r.error().contains("nowhere"));
      assertNotNull(r.query().sql());
      assertEquals(0, engine.executions.get());
    }
  }

  @Test
  void storeErrorIsSurfacedWithItsMessage() {
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), new CountingResolver(), limits(Duration.ofSeconds(5)), c -> {
      throw new StoreExecutionException("column \"state\" does not exist", null);
    })) {
      ReportResult r = engine.execute(QuerySpec.builder("facilities").dimension("state").build());
      assertFalse(r.success());
      assertEquals(ReportStatus.FAILED, r.status());
      assertEquals(ErrorKind.EXECUTION_ERROR, r.errorKind());
      assertEquals("column \"state\" does not exist", r.error());
      assertNull(r.data());
      assertEquals("facilities", r.query().source());
    }
  }

  @Test
  void storeReportedTimeoutIsATimeout() {
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), new CountingResolver(), limits(Duration.ofSeconds(5)), c -> {
      throw new StoreExecutionException("canceling statement due to statement timeout", null, true);
    })) {
      ReportResult r = engine.execute(QuerySpec.builder("facilities").dimension("state").build());
      assertEquals(ReportStatus.TIMED_OUT, r.status());
      assertEquals(ErrorKind.TIMEOUT, r.errorKind());
    }
  }

  @Test
  void timeoutWinsTheRaceAndCancelsTheStatement() throws Exception {
    CountDownLatch cancelled = new CountDownLatch(1);
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), new CountingResolver(), limits(Duration.ofMillis(50)), c -> {
      c.register(cancelled::countDown);
      try {
        cancelled.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return oneRow();
    })) {
      ReportResult r = engine.execute(QuerySpec.builder("facilities").dimension("state").build());

      assertFalse(r.success());
      assertEquals(ReportStatus.TIMED_OUT, r.status());
      assertEquals(ErrorKind.TIMEOUT, r.errorKind());
      assertEquals("Query timeout", r.error());
      assertNull(r.data());
      assertNotNull(r.query().sql());
      assertTrue(cancelled.await(1, TimeUnit.SECONDS));
    }
  }

  @Test
  void compileThrowsValidationErrors() {
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), new CountingResolver(), limits(Duration.ofSeconds(5)), c -> oneRow())) {
      QueryValidationException ex = assertThrows(QueryValidationException.class,
          () -> engine.compile(QuerySpec.builder("nope").dimension("state").build()));
      assertEquals(ErrorKind.UNKNOWN_SOURCE, ex.kind());

      CompiledQuery q = engine.compile(QuerySpec.builder("facilities").dimension("state").limit(7).build());
      assertTrue(q.sql().endsWith("LIMIT 7"));
      assertEquals(0, engine.executions.get());
    }
  }

  @Test
  void nullSpecIsAFailureNotAnException() {
    try (FakeEngine engine = new FakeEngine(new RecordingDialect(), new CountingResolver(), limits(Duration.ofSeconds(5)), c -> oneRow())) {
      ReportResult r = engine.execute(null);
      assertEquals(ErrorKind.UNKNOWN_SOURCE, r.errorKind());
    }
  }
}
