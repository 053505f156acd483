package io.intellixity.reportql.query.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.reportql.query.*;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON deserializer for {@link QuerySpec}.
 * <p>
 * Missing optional members become empty. Every dimension, metric, condition and order entry must name a
 * field; entries without one are rejected. Token validity is not checked here.
 */
public final class QuerySpecJsonDeserializer extends JsonDeserializer<QuerySpec> {
  private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
  private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);

  @Override
  public QuerySpec deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("QuerySpec JSON must be an object");

    String source = textOrNull(root.get("source"));

    List<Dimension> dimensions = new ArrayList<>();
    JsonNode dims = root.get("dimensions");
    if (dims != null && dims.isArray()) {
      for (JsonNode d : dims) {
        if (d.isTextual()) {
          dimensions.add(new Dimension(d.asText()));
          continue;
        }
        String field = requireField(d, "dimension");
        dimensions.add(new Dimension(field, textOrNull(d.get("transform")), textOrNull(d.get("alias"))));
      }
    }

    List<Metric> metrics = new ArrayList<>();
    JsonNode mets = root.get("metrics");
    if (mets != null && mets.isArray()) {
      for (JsonNode m : mets) {
        String field = requireField(m, "metric");
        metrics.add(new Metric(field, textOrNull(m.get("aggregation")), textOrNull(m.get("alias"))));
      }
    }

    FilterGroup filters = null;
    JsonNode f = root.get("filters");
    if (f != null && f.isObject()) filters = parseFilters(f, codec);

    List<OrderField> orderBy = new ArrayList<>();
    JsonNode ob = root.get("orderBy");
    if (ob != null && ob.isArray()) {
      for (JsonNode o : ob) {
        String field = requireField(o, "orderBy entry");
        orderBy.add(new OrderField(field, OrderField.Direction.parse(textOrNull(o.get("direction")))));
      }
    }

    return new QuerySpec(source, dimensions, metrics, filters, orderBy, intOrNull(root.get("limit")));
  }

  private static FilterGroup parseFilters(JsonNode f, ObjectCodec codec) throws IOException {
    String op = textOrNull(f.get("operator"));
    Clause clause = "OR".equalsIgnoreCase(op) ? Clause.OR : Clause.AND;

    List<Condition> out = new ArrayList<>();
    JsonNode conds = f.get("conditions");
    if (conds != null && conds.isArray()) {
      for (JsonNode c : conds) {
        String field = requireField(c, "condition");
        out.add(new Condition(field, textOrNull(c.get("operator")), decodeValue(c.get("value"), codec)));
      }
    }
    return new FilterGroup(clause, out);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String requireField(JsonNode entry, String what) {
    String field = entry.isObject() ? textOrNull(entry.get("field")) : null;
    if (field == null) throw new IllegalArgumentException(what + " requires field");
    return field;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  /** Integers beyond the int range saturate, so an oversized limit still clamps to the row ceiling. */
  private static Integer intOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    BigInteger v;
    if (n.isIntegralNumber()) {
      v = n.bigIntegerValue();
    } else {
      String s = n.asText().trim();
      if (s.isEmpty()) return null;
      try {
        v = new BigInteger(s);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("limit must be an integer: " + s, e);
      }
    }
    if (v.compareTo(INT_MAX) > 0) return Integer.MAX_VALUE;
    if (v.compareTo(INT_MIN) < 0) return Integer.MIN_VALUE;
    return v.intValue();
  }
}
