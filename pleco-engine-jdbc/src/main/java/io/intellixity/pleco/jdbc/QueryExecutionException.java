package io.intellixity.pleco.jdbc;

import io.intellixity.pleco.PlecoException;

/** A built statement failed to execute. */
public final class QueryExecutionException extends PlecoException {
  public QueryExecutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
