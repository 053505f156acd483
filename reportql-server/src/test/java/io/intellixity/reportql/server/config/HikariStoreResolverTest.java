package io.intellixity.reportql.server.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class HikariStoreResolverTest {

  @Test
  void unknownStoreIsRejected() {
    try (HikariStoreResolver r = new HikariStoreResolver(Map.of())) {
      IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> r.resolve("main"));
      assertEquals("Unknown store: main", e.getMessage());
      assertThrows(IllegalArgumentException.class, () -> r.resolve(null));
    }
  }

  @Test
  void storeWithoutUrlIsRejectedBeforeAnyPoolIsCreated() {
    ReportsProperties.StoreDb db = new ReportsProperties.StoreDb();
    db.setUsername("reports");
    try (HikariStoreResolver r = new HikariStoreResolver(Map.of("market", db))) {
      IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> r.resolve("market"));
      assertTrue(e.getMessage().contains("store=market"));
    }
  }
}
