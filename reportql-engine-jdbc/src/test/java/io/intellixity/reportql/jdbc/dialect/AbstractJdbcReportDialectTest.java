package io.intellixity.reportql.jdbc.dialect;

import io.intellixity.reportql.exec.CompiledQuery;
import io.intellixity.reportql.jdbc.TestSources;
import io.intellixity.reportql.query.Clause;
import io.intellixity.reportql.query.ErrorKind;
import io.intellixity.reportql.query.OrderField;
import io.intellixity.reportql.query.QuerySpec;
import io.intellixity.reportql.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcReportDialectTest {
  private final TestSources.BucketDialect dialect = new TestSources.BucketDialect();

  @Test
  void assemblesClausesInOrder() {
    QuerySpec spec = QuerySpec.builder("facilities")
        .dimension("state")
        .metric("certified_beds", "SUM", "total_beds")
        .where("state", "=", "CA")
        .orderBy("total_beds", OrderField.Direction.DESC)
        .limit(10)
        .build();

    CompiledQuery q = dialect.compile(TestSources.facilities(), spec, 10);

    assertEquals("SELECT state, SUM(certified_beds) AS total_beds FROM snf_facilities WHERE state = $1 "
        + "GROUP BY state ORDER BY total_beds DESC LIMIT 10", q.sql());
    assertEquals(List.of("CA"), q.params());
    assertEquals("facilities", q.sourceKey());
  }

  @Test
  void projectionOnlyQueryHasNoGroupBy() {
    CompiledQuery q = dialect.compile(TestSources.facilities(),
        QuerySpec.builder("facilities").dimension("state").dimension("zip").build(), 10_000);
    assertEquals("SELECT state, zip FROM snf_facilities LIMIT 10000", q.sql());
    assertTrue(q.params().isEmpty());
  }

  @Test
  void placeholdersAreNumberedAcrossTheWholeStatement() {
    QuerySpec spec = QuerySpec.builder("facilities")
        .metric("certified_beds", "AVG")
        .where("state", "IN", List.of("CA", "NV"))
        .where("certified_beds", "BETWEEN", List.of(10, 200))
        .where("zip", "ILIKE", "94")
        .clause(Clause.OR)
        .build();
    CompiledQuery q = dialect.compile(TestSources.facilities(), spec, 5);
    assertEquals("SELECT AVG(certified_beds) AS avg_certified_beds FROM snf_facilities "
        + "WHERE state IN ($1, $2) OR certified_beds BETWEEN $3 AND $4 OR zip ILIKE $5 LIMIT 5", q.sql());
    assertEquals(List.of("CA", "NV", 10, 200, "%94%"), q.params());
  }

  @Test
  void everyCompilationStartsAFreshCursor() {
    QuerySpec spec = QuerySpec.builder("facilities").dimension("state").where("state", "=", "CA").build();
    CompiledQuery a = dialect.compile(TestSources.facilities(), spec, 1);
    CompiledQuery b = dialect.compile(TestSources.facilities(), spec, 1);
    assertEquals(a.sql(), b.sql());
    assertTrue(b.sql().contains("$1"));
    assertFalse(b.sql().contains("$2"));
  }

  @Test
  void undeclaredFieldAnywhereFails() {
    List<QuerySpec> specs = List.of(
        QuerySpec.builder("facilities").dimension("secret").build(),
        QuerySpec.builder("facilities").metric("secret", "COUNT").build(),
        QuerySpec.builder("facilities").dimension("state").where("secret", "=", "x").build());
    for (QuerySpec s : specs) {
      QueryValidationException ex = assertThrows(QueryValidationException.class,
          () -> dialect.compile(TestSources.facilities(), s, 10));
      assertEquals(ErrorKind.UNKNOWN_FIELD, ex.kind());
      assertEquals("secret", ex.token());
    }
  }

  @Test
  void nonPositiveLimitIsAProgrammingError() {
    assertThrows(IllegalArgumentException.class,
        () -> dialect.compile(TestSources.facilities(), QuerySpec.builder("facilities").dimension("state").build(), 0));
  }
}
