package io.intellixity.pleco.compile;

import io.intellixity.pleco.PlecoException;

/** A filter or sort names a field that cannot be resolved under {@link UnknownFieldPolicy#REJECT}. */
public final class MissingSubqueryException extends PlecoException {
  private final String field;

  public MissingSubqueryException(String field, String usage) {
    super("No subquery registered for " + usage + " field '" + field + "'");
    this.field = field;
  }

  public String field() {
    return field;
  }
}
