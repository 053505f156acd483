package io.intellixity.reportql.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cancellation token handed to store execution.
 * <p>
 * The executing side registers how to abort its in-flight call (JDBC: {@code Statement::cancel}); the
 * engine calls {@link #cancel()} when the timeout wins. A registration after cancellation aborts immediately.
 * Cancellation is best-effort: a failing canceller is logged and otherwise ignored.
 */
public final class QueryCancellation {
  private static final Logger log = LoggerFactory.getLogger(QueryCancellation.class);

  @FunctionalInterface
  public interface Canceller {
    void cancel() throws Exception;
  }

  private Canceller canceller;
  private boolean cancelled;

  public void register(Canceller c) {
    boolean runNow;
    synchronized (this) {
      runNow = cancelled;
      if (!runNow) canceller = c;
    }
    if (runNow) invoke(c);
  }

  /** Called once the store call has returned; later cancels become no-ops for the store. */
  public synchronized void clear() {
    canceller = null;
  }

  public void cancel() {
    Canceller c;
    synchronized (this) {
      if (cancelled) return;
      cancelled = true;
      c = canceller;
      canceller = null;
    }
    if (c != null) invoke(c);
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  private static void invoke(Canceller c) {
    try {
      c.cancel();
    } catch (Exception e) {
      log.warn("reportql.cancel failed error={}", e.toString());
    }
  }
}
