package io.intellixity.reportql.spi.exec;

import io.intellixity.reportql.catalog.SourceDefinition;
import io.intellixity.reportql.catalog.SourceRegistry;
import io.intellixity.reportql.exec.CompiledQuery;
import io.intellixity.reportql.exec.QueryCancellation;
import io.intellixity.reportql.exec.QueryEcho;
import io.intellixity.reportql.exec.ReportEngine;
import io.intellixity.reportql.exec.ReportLimits;
import io.intellixity.reportql.exec.ReportPhase;
import io.intellixity.reportql.exec.ReportResult;
import io.intellixity.reportql.exec.StoreExecutionException;
import io.intellixity.reportql.exec.handle.StoreHandle;
import io.intellixity.reportql.exec.handle.StoreHandleResolver;
import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.QuerySpec;
import io.intellixity.reportql.query.QueryValidationException;
import io.intellixity.reportql.spi.sql.ReportDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Template-method report engine.
 *
 * Phases: {@link ReportPhase#VALIDATING} -> {@link ReportPhase#BUILDING} -> {@link ReportPhase#ROUTING}
 * -> {@link ReportPhase#EXECUTING}, ending in succeeded, failed or timed out.
 *
 * Backends implement {@link #executeQuery}; the engine owns validation, clamping, store routing,
 * the timeout race and conversion of every failure into a {@link ReportResult}.
 */
public abstract class AbstractReportEngine<H extends StoreHandle<?>> implements ReportEngine, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AbstractReportEngine.class);

  private final ReportDialect dialect;
  private final SourceRegistry registry;
  private final StoreHandleResolver<H> stores;
  private final ReportLimits limits;
  private final SpecValidationStrategy validation;
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  /**
   * DI-friendly constructor. The executor is owned by the caller and is not shut down by {@link #close()}.
   */
  protected AbstractReportEngine(ReportDialect dialect,
                                 SourceRegistry registry,
                                 StoreHandleResolver<H> stores,
                                 ReportLimits limits,
                                 SpecValidationStrategy validation,
                                 ExecutorService executor) {
    this(dialect, registry, stores, limits, validation, executor, false);
  }

  protected AbstractReportEngine(ReportDialect dialect,
                                 SourceRegistry registry,
                                 StoreHandleResolver<H> stores,
                                 ReportLimits limits) {
    this(dialect, registry, stores, limits, new DefaultSpecValidationStrategy(), newExecutor(), true);
  }

  private AbstractReportEngine(ReportDialect dialect,
                               SourceRegistry registry,
                               StoreHandleResolver<H> stores,
                               ReportLimits limits,
                               SpecValidationStrategy validation,
                               ExecutorService executor,
                               boolean ownsExecutor) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.stores = Objects.requireNonNull(stores, "stores");
    this.limits = Objects.requireNonNull(limits, "limits");
    this.validation = Objects.requireNonNull(validation, "validation");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.ownsExecutor = ownsExecutor;
  }

  protected final ReportDialect dialect() { return dialect; }
  protected final SourceRegistry registry() { return registry; }
  protected final ReportLimits limits() { return limits; }

  /**
   * Run a compiled statement against a store and return its rows, keyed by column label in select order.
   * <p>
   * Implementations register an abort action on {@code cancellation} before blocking on the store and
   * throw {@link StoreExecutionException} when the store rejects the statement.
   */
  protected abstract List<Map<String, Object>> executeQuery(H handle, CompiledQuery query, QueryCancellation cancellation);

  @Override
  public final CompiledQuery compile(QuerySpec spec) {
    SourceDefinition source = validation.validate(spec, registry);
    return dialect.compile(source, spec, limits.effectiveLimit(spec.limit()));
  }

  @Override
  public final ReportResult preview(QuerySpec spec) {
    return execute(spec == null ? null : spec.withLimit(limits.previewRows()));
  }

  @Override
  public final ReportResult execute(QuerySpec spec) {
    long start = System.nanoTime();
    String sourceKey = (spec == null) ? null : spec.source();
    ReportPhase phase = ReportPhase.VALIDATING;
    CompiledQuery compiled = null;
    String storeId = null;

    try {
      SourceDefinition source = validation.validate(spec, registry);

      phase = ReportPhase.BUILDING;
      compiled = dialect.compile(source, spec, limits.effectiveLimit(spec.limit()));

      phase = ReportPhase.ROUTING;
      storeId = source.storeId();
      H handle = stores.resolve(storeId);

      phase = ReportPhase.EXECUTING;
      List<Map<String, Object>> rows = runWithTimeout(handle, compiled);
      long ms = elapsedMs(start);
      if (log.isDebugEnabled()) {
        log.debug("reportql.report op=execute status=SUCCEEDED source={} store={} handleId={} rows={} durationMs={}",
            sourceKey, storeId, handle.id(), rows.size(), ms);
      }
      return ReportResult.succeeded(rows, ms, QueryEcho.of(compiled));

    } catch (QueryValidationException e) {
      if (log.isDebugEnabled()) {
        log.debug("reportql.report op=execute status=FAILED phase={} source={} errorKind={} token={}",
            phase, sourceKey, e.kind(), e.token());
      }
      return ReportResult.failed(e.kind(), e.getMessage(), echo(compiled, sourceKey));

    } catch (TimeoutException e) {
      log.warn("reportql.report op=execute status=TIMED_OUT source={} store={} timeoutMs={}",
          sourceKey, storeId, limits.timeout().toMillis());
      return ReportResult.failed(ErrorKind.TIMEOUT, "Query timeout", echo(compiled, sourceKey));

    } catch (StoreExecutionException e) {
      ErrorKind kind = e.timedOut() ? ErrorKind.TIMEOUT : ErrorKind.EXECUTION_ERROR;
      log.warn("reportql.report op=execute status=FAILED phase={} source={} store={} errorKind={} error={}",
          phase, sourceKey, storeId, kind, e.getMessage());
      return ReportResult.failed(kind, e.timedOut() ? "Query timeout" : e.getMessage(), echo(compiled, sourceKey));

    } catch (RuntimeException e) {
      log.warn("reportql.report op=execute status=FAILED phase={} source={} store={} errorKind={} error={}",
          phase, sourceKey, storeId, ErrorKind.EXECUTION_ERROR, e.toString());
      return ReportResult.failed(ErrorKind.EXECUTION_ERROR, messageOf(e), echo(compiled, sourceKey));
    }
  }

  private List<Map<String, Object>> runWithTimeout(H handle, CompiledQuery compiled) throws TimeoutException {
    QueryCancellation cancellation = new QueryCancellation();
    Future<List<Map<String, Object>>> future = executor.submit(() -> executeQuery(handle, compiled, cancellation));
    try {
      List<Map<String, Object>> rows = future.get(limits.timeout().toMillis(), TimeUnit.MILLISECONDS);
      return (rows == null) ? List.of() : rows;
    } catch (TimeoutException e) {
      cancellation.cancel();
      future.cancel(true);
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancellation.cancel();
      future.cancel(true);
      throw new StoreExecutionException("Interrupted while waiting for query", e);
    } catch (ExecutionException e) {
      Throwable cause = (e.getCause() == null) ? e : e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      throw new StoreExecutionException(messageOf(cause), cause);
    }
  }

  private static QueryEcho echo(CompiledQuery compiled, String sourceKey) {
    return (compiled != null) ? QueryEcho.of(compiled) : QueryEcho.sourceOnly(sourceKey);
  }

  private static String messageOf(Throwable t) {
    return (t.getMessage() == null) ? t.getClass().getSimpleName() : t.getMessage();
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static ExecutorService newExecutor() {
    AtomicInteger n = new AtomicInteger();
    ThreadFactory tf = r -> {
      Thread t = new Thread(r, "reportql-exec-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return Executors.newCachedThreadPool(tf);
  }

  @Override
  public void close() {
    if (ownsExecutor) executor.shutdownNow();
  }
}
