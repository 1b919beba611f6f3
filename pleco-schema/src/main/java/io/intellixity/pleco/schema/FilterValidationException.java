package io.intellixity.pleco.schema;

import io.intellixity.pleco.PlecoException;

/** Request input does not match its {@link FilterSchema}. */
public final class FilterValidationException extends PlecoException {
  private final String path;

  public FilterValidationException(String path, String reason) {
    super("Invalid '" + path + "': " + reason);
    this.path = path;
  }

  /** Location of the offending key, e.g. {@code filter.year.gte} or {@code filter.AND[1].make}. */
  public String path() { return path; }
}
