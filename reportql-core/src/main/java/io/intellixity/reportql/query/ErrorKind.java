package io.intellixity.reportql.query;

/** Failure taxonomy surfaced in report results. */
public enum ErrorKind {
  UNKNOWN_SOURCE,
  UNKNOWN_FIELD,
  UNSUPPORTED_OPERATOR,
  UNSUPPORTED_AGGREGATION,
  UNSUPPORTED_TRANSFORM,
  MALFORMED_CONDITION_VALUE,
  EMPTY_PROJECTION,
  INVALID_IDENTIFIER,
  EXECUTION_ERROR,
  TIMEOUT
}
