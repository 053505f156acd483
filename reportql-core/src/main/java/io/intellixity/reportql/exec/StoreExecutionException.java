package io.intellixity.reportql.exec;

/**
 * A store rejected or aborted a compiled statement.
 * <p>
 * {@link #timedOut()} is set when the store itself reports a statement timeout or cancellation.
 */
public final class StoreExecutionException extends RuntimeException {
  private final boolean timedOut;

  public StoreExecutionException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public StoreExecutionException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  public boolean timedOut() { return timedOut; }
}
