package io.intellixity.reportql.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.reportql.exec.handle.StoreHandleResolver;
import io.intellixity.reportql.jdbc.JdbcHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One HikariCP pool per configured store, created on first use.
 */
public final class HikariStoreResolver implements StoreHandleResolver<JdbcHandle>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HikariStoreResolver.class);

  private final Map<String, ReportsProperties.StoreDb> stores;
  private final Map<String, JdbcHandle> handles = new ConcurrentHashMap<>();
  private final Map<String, HikariDataSource> pools = new ConcurrentHashMap<>();

  public HikariStoreResolver(Map<String, ReportsProperties.StoreDb> stores) {
    this.stores = Map.copyOf(Objects.requireNonNull(stores, "stores"));
  }

  @Override
  public JdbcHandle resolve(String storeId) {
    ReportsProperties.StoreDb db = (storeId == null) ? null : stores.get(storeId);
    if (db == null) throw new IllegalArgumentException("Unknown store: " + storeId);
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing jdbcUrl for store=" + storeId);
    }
    return handles.computeIfAbsent(storeId, id -> new JdbcHandle("jdbc:" + id, pool(id, db)));
  }

  private HikariDataSource pool(String storeId, ReportsProperties.StoreDb db) {
    return pools.computeIfAbsent(storeId, k -> {
      HikariConfig hc = new HikariConfig();
      hc.setPoolName("reportql-" + storeId);
      hc.setJdbcUrl(db.getJdbcUrl());
      hc.setUsername(db.getUsername());
      hc.setPassword(db.getPassword());
      hc.setMaximumPoolSize(db.getMaximumPoolSize());
      hc.setIdleTimeout(db.getIdleTimeout().toMillis());
      hc.setConnectionTimeout(db.getConnectionTimeout().toMillis());
      hc.setReadOnly(true);
      log.info("reportql.pool create store={} maxPoolSize={}", storeId, db.getMaximumPoolSize());
      return new HikariDataSource(hc);
    });
  }

  @Override
  public void close() {
    for (Map.Entry<String, HikariDataSource> e : pools.entrySet()) {
      log.info("reportql.pool close store={}", e.getKey());
      e.getValue().close();
    }
    pools.clear();
    handles.clear();
  }
}
