package io.intellixity.pleco.compile;

/** What a compiler does with a field name that has no registered subquery. */
public enum UnknownFieldPolicy {
  /** Treat the field as a column of the query being compiled. */
  COLUMN,
  /** Fail with {@link MissingSubqueryException}. */
  REJECT
}
