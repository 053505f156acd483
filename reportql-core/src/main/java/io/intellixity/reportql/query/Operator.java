package io.intellixity.reportql.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Filter operators accepted in a {@link Condition}. Tokens are the SQL spelling. */
public enum Operator {
  EQ("=", Arity.SCALAR),
  NE("!=", Arity.SCALAR),
  NE_ANSI("<>", Arity.SCALAR),
  GT(">", Arity.SCALAR),
  GE(">=", Arity.SCALAR),
  LT("<", Arity.SCALAR),
  LE("<=", Arity.SCALAR),
  LIKE("LIKE", Arity.PATTERN),
  ILIKE("ILIKE", Arity.PATTERN),
  IN("IN", Arity.LIST),
  NOT_IN("NOT IN", Arity.LIST),
  IS_NULL("IS NULL", Arity.NONE),
  IS_NOT_NULL("IS NOT NULL", Arity.NONE),
  BETWEEN("BETWEEN", Arity.PAIR);

  /** Value shape an operator expects. */
  public enum Arity { NONE, SCALAR, PATTERN, LIST, PAIR }

  private static final Map<String, Operator> BY_TOKEN;

  static {
    Map<String, Operator> m = new LinkedHashMap<>();
    for (Operator op : values()) m.put(op.token, op);
    BY_TOKEN = Collections.unmodifiableMap(m);
  }

  private final String token;
  private final Arity arity;

  Operator(String token, Arity arity) {
    this.token = token;
    this.arity = arity;
  }

  public String token() { return token; }
  public Arity arity() { return arity; }

  /**
   * Case-insensitive lookup; surrounding whitespace is trimmed and inner whitespace runs collapse to one space.
   * Returns null for anything outside the fixed set.
   */
  public static Operator fromToken(String raw) {
    if (raw == null) return null;
    String canonical = raw.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    return BY_TOKEN.get(canonical);
  }

  public static List<String> tokens() {
    return List.copyOf(BY_TOKEN.keySet());
  }
}
