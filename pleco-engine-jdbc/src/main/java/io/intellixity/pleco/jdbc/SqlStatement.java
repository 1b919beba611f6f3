package io.intellixity.pleco.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rendered SQL with named placeholders ({@code :b1 .. :bn}) and their values in placeholder order.
 * Bind values may be {@code null}.
 */
public record SqlStatement(String sql, List<Object> binds) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = (binds == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(binds));
  }

  /** SQL with every named placeholder rewritten to {@code ?}. */
  public String jdbcSql() {
    return NamedParameters.toJdbcSql(sql);
  }
}
