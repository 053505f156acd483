package io.intellixity.reportql.query.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.reportql.query.Clause;
import io.intellixity.reportql.query.Condition;
import io.intellixity.reportql.query.Dimension;
import io.intellixity.reportql.query.Metric;
import io.intellixity.reportql.query.OrderField;
import io.intellixity.reportql.query.QuerySpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QuerySpecJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesFullSpec() throws Exception {
    String s = """
        {
          "source": "facilities",
          "dimensions": [ { "field": "state" }, { "field": "survey_date", "transform": "month", "alias": "m" } ],
          "metrics": [ { "field": "certified_beds", "aggregation": "SUM", "alias": "total_beds" } ],
          "filters": {
            "operator": "or",
            "conditions": [
              { "field": "state", "operator": "=", "value": "CA" },
              { "field": "zip", "operator": "IN", "value": ["A", "B"] },
              { "field": "zip", "operator": "IS NULL" }
            ]
          },
          "orderBy": [ { "field": "total_beds", "direction": "desc" }, { "field": "state" } ],
          "limit": 10
        }
        """;
    QuerySpec q = JSON.readValue(s, QuerySpec.class);

    assertEquals("facilities", q.source());
    assertEquals(List.of(new Dimension("state"), new Dimension("survey_date", "month", "m")), q.dimensions());
    assertEquals(List.of(new Metric("certified_beds", "SUM", "total_beds")), q.metrics());

    assertEquals(Clause.OR, q.filters().clause());
    List<Condition> cs = q.filters().conditions();
    assertEquals(3, cs.size());
    assertEquals("CA", cs.get(0).value());
    assertEquals(List.of("A", "B"), cs.get(1).value());
    assertNull(cs.get(2).value());

    assertEquals(OrderField.Direction.DESC, q.orderBy().get(0).direction());
    assertEquals(OrderField.Direction.ASC, q.orderBy().get(1).direction());
    assertEquals(10, q.limit());
  }

  @Test
  void missingOptionalMembersBecomeEmpty() throws Exception {
    QuerySpec q = JSON.readValue("{ \"source\": \"deals\", \"metrics\": [ { \"field\": \"purchase_price\", \"aggregation\": \"AVG\" } ] }",
        QuerySpec.class);
    assertTrue(q.dimensions().isEmpty());
    assertTrue(q.filters().isEmpty());
    assertEquals(Clause.AND, q.filters().clause());
    assertTrue(q.orderBy().isEmpty());
    assertNull(q.limit());
    assertTrue(q.hasProjection());
  }

  @Test
  void unrecognizedConnectiveFallsBackToAnd() throws Exception {
    QuerySpec q = JSON.readValue("""
        { "source": "s", "filters": { "operator": "XOR; DROP", "conditions": [] } }
        """, QuerySpec.class);
    assertEquals(Clause.AND, q.filters().clause());
    assertFalse(q.hasProjection());
  }

  @Test
  void directionOtherThanDescSortsAscending() throws Exception {
    QuerySpec q = JSON.readValue("""
        { "source": "s", "orderBy": [ { "field": "a", "direction": "descending" } ] }
        """, QuerySpec.class);
    assertEquals(OrderField.Direction.ASC, q.orderBy().get(0).direction());
  }

  @Test
  void numericValuesKeepJsonTypes() throws Exception {
    QuerySpec q = JSON.readValue("""
        { "source": "s", "filters": { "conditions": [ { "field": "beds", "operator": "BETWEEN", "value": [10, 99.5] } ] } }
        """, QuerySpec.class);
    assertEquals(List.of(10, 99.5), q.filters().conditions().get(0).value());
  }

  @Test
  void nonIntegerLimitIsRejected() {
    assertThrows(Exception.class, () -> JSON.readValue("{ \"source\": \"s\", \"limit\": \"ten\" }", QuerySpec.class));
  }

  @Test
  void conditionWithoutFieldIsRejected() {
    Exception e = assertThrows(Exception.class, () -> JSON.readValue("""
        { "source": "facilities", "dimensions": ["state"],
          "filters": { "conditions": [ { "fieldName": "state", "operator": "=", "value": "CA" } ] } }
        """, QuerySpec.class));
    assertTrue(e.getMessage().contains("condition requires field"), e.getMessage());
  }

  @Test
  void dimensionWithoutFieldIsRejected() {
    Exception e = assertThrows(Exception.class, () -> JSON.readValue("""
        { "source": "facilities", "dimensions": [ { "name": "state" } ] }
        """, QuerySpec.class));
    assertTrue(e.getMessage().contains("dimension requires field"), e.getMessage());

    assertThrows(Exception.class, () -> JSON.readValue("{ \"source\": \"s\", \"dimensions\": [ 42 ] }", QuerySpec.class));
  }

  @Test
  void metricWithoutFieldIsRejected() {
    Exception e = assertThrows(Exception.class, () -> JSON.readValue("""
        { "source": "facilities", "metrics": [ { "aggregation": "COUNT" } ] }
        """, QuerySpec.class));
    assertTrue(e.getMessage().contains("metric requires field"), e.getMessage());
  }

  @Test
  void orderEntryWithoutFieldIsRejected() {
    assertThrows(Exception.class, () -> JSON.readValue("""
        { "source": "facilities", "dimensions": ["state"], "orderBy": [ "state" ] }
        """, QuerySpec.class));
  }

  @Test
  void limitBeyondIntRangeSaturates() throws Exception {
    QuerySpec big = JSON.readValue("{ \"source\": \"s\", \"limit\": 4294967306 }", QuerySpec.class);
    assertEquals(Integer.MAX_VALUE, big.limit());

    QuerySpec text = JSON.readValue("{ \"source\": \"s\", \"limit\": \"99999999999999999999\" }", QuerySpec.class);
    assertEquals(Integer.MAX_VALUE, text.limit());

    QuerySpec negative = JSON.readValue("{ \"source\": \"s\", \"limit\": -4294967306 }", QuerySpec.class);
    assertEquals(Integer.MIN_VALUE, negative.limit());
  }
}
