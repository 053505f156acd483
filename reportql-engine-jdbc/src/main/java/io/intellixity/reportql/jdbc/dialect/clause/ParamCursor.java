package io.intellixity.reportql.jdbc.dialect.clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Placeholder counter shared by every clause of one compilation.
 * <p>
 * Each {@link #bind} appends the value and returns the next placeholder, so parameter order always matches
 * placeholder order in the text. One cursor per compilation; not thread-safe.
 */
public final class ParamCursor {
  private final IntFunction<String> placeholder;
  private final List<Object> params = new ArrayList<>();
  private int next = 1;

  public ParamCursor(IntFunction<String> placeholder) {
    this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
  }

  public String bind(Object value) {
    params.add(value);
    return placeholder.apply(next++);
  }

  public int count() {
    return params.size();
  }

  public List<Object> params() {
    return Collections.unmodifiableList(params);
  }
}
