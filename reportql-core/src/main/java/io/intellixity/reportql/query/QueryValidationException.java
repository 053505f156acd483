package io.intellixity.reportql.query;

import java.util.Objects;

/**
 * Raised when a {@link QuerySpec} references an unknown source/field, uses a token outside the fixed
 * vocabularies, or carries a value of the wrong shape.
 * <p>
 * Always thrown before any store is contacted. {@link #token()} is the offending caller token (may be null).
 */
public final class QueryValidationException extends RuntimeException {
  private final ErrorKind kind;
  private final String token;

  public QueryValidationException(ErrorKind kind, String token, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.token = token;
  }

  public QueryValidationException(ErrorKind kind, String token, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.token = token;
  }

  public ErrorKind kind() { return kind; }
  public String token() { return token; }
}
