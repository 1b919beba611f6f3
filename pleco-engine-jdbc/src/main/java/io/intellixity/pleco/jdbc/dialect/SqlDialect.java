package io.intellixity.pleco.jdbc.dialect;

/** Database-specific parts of SQL rendering: identifier quoting and paging syntax. */
public interface SqlDialect {
  String id();

  /**
   * Quote a column or table reference. Dotted paths are quoted part by part, {@code *} is kept as is, and
   * {@code "expr as alias"} renders as {@code expr AS alias}.
   */
  String quoteRef(String ref);

  /** Append paging to a complete SELECT. Either bound may be {@code null}. */
  String applyPage(String sql, Integer limit, Integer offset);
}
