package io.intellixity.pleco.querybuilder;

import io.intellixity.pleco.PlecoException;

/** A query builder was constructed without a backing connection/dialect or seed query. */
public final class QueryConfigurationException extends PlecoException {
  public QueryConfigurationException(String message) {
    super(message);
  }
}
