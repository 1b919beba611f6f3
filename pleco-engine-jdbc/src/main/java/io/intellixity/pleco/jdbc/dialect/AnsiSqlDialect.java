package io.intellixity.pleco.jdbc.dialect;

/** SQL:2008 dialect: double-quoted identifiers, {@code OFFSET .. ROWS FETCH .. ROWS ONLY} paging. */
public final class AnsiSqlDialect extends AbstractSqlDialect {
  @Override public String id() { return "ansi"; }

  @Override
  protected String quoteIdent(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public String applyPage(String sql, Integer limit, Integer offset) {
    StringBuilder out = new StringBuilder(sql);
    if (offset != null) out.append(" OFFSET ").append(offset).append(" ROWS");
    if (limit != null) {
      out.append(offset == null ? " FETCH FIRST " : " FETCH NEXT ").append(limit).append(" ROWS ONLY");
    }
    return out.toString();
  }
}
