package io.intellixity.pleco.compile;

import io.intellixity.pleco.query.PageDefaults;

import java.util.Objects;

/**
 * Compiler configuration.
 *
 * @param resourceIdColumn  id column of the base query, correlated with the subqueries' {@code resource_id}
 * @param unknownFieldPolicy handling of fields without a registered subquery (filter and sort)
 * @param pageDefaults      defaults for absent page bounds
 */
public record CompilerOptions(String resourceIdColumn, UnknownFieldPolicy unknownFieldPolicy, PageDefaults pageDefaults) {
  public static final CompilerOptions DEFAULT = new CompilerOptions("id", UnknownFieldPolicy.COLUMN, PageDefaults.DEFAULT);

  public CompilerOptions {
    Objects.requireNonNull(resourceIdColumn, "resourceIdColumn");
    if (resourceIdColumn.isBlank()) throw new IllegalArgumentException("resourceIdColumn must not be blank");
    unknownFieldPolicy = (unknownFieldPolicy == null) ? UnknownFieldPolicy.COLUMN : unknownFieldPolicy;
    pageDefaults = (pageDefaults == null) ? PageDefaults.DEFAULT : pageDefaults;
  }

  public CompilerOptions withResourceIdColumn(String column) {
    return new CompilerOptions(column, unknownFieldPolicy, pageDefaults);
  }

  public CompilerOptions withUnknownFieldPolicy(UnknownFieldPolicy policy) {
    return new CompilerOptions(resourceIdColumn, policy, pageDefaults);
  }

  public CompilerOptions withPageDefaults(PageDefaults defaults) {
    return new CompilerOptions(resourceIdColumn, unknownFieldPolicy, defaults);
  }
}
