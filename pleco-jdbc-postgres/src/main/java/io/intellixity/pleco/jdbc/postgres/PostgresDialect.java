package io.intellixity.pleco.jdbc.postgres;

import io.intellixity.pleco.jdbc.dialect.AbstractSqlDialect;

/**
 * Postgres dialect.
 * <p>
 * Generic rendering lives in {@link io.intellixity.pleco.jdbc.SqlQueryBuilder}; only quoting and
 * {@code LIMIT/OFFSET} paging are Postgres-specific.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String applyPage(String sql, Integer limit, Integer offset) {
    StringBuilder out = new StringBuilder(sql);
    if (limit != null) out.append(" LIMIT ").append(limit);
    if (offset != null) out.append(" OFFSET ").append(offset);
    return out.toString();
  }
}
