package io.intellixity.reportql.jdbc;

import io.intellixity.reportql.exec.handle.StoreHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC store handle: a pooled DataSource for one physical store. */
public final class JdbcHandle implements StoreHandle<DataSource> {
  private final String id;
  private final DataSource client;

  public JdbcHandle(String id, DataSource client) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
}
