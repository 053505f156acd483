package io.intellixity.reportql.exec.handle;

/**
 * Resolved runtime handle for one physical store.
 * <p>
 * JDBC: {@code client()} is a pooled {@code javax.sql.DataSource}.
 */
public interface StoreHandle<TClient> {
  /** Store identifier, as referenced by source definitions. */
  String id();

  TClient client();
}
