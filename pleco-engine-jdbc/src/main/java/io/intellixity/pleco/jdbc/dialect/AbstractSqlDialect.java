package io.intellixity.pleco.jdbc.dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Common reference quoting. Dialects supply {@link #quoteIdent(String)} for a single identifier and their
 * paging syntax.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  private static final Pattern ALIASED = Pattern.compile("^\\s*(.+?)\\s+(?i:as)\\s+(\\S+)\\s*$");

  @Override
  public final String quoteRef(String ref) {
    Objects.requireNonNull(ref, "ref");
    Matcher m = ALIASED.matcher(ref);
    if (m.matches()) {
      return quotePath(m.group(1)) + " AS " + quoteIdent(m.group(2));
    }
    return quotePath(ref);
  }

  protected String quotePath(String path) {
    String p = path.trim();
    if (p.isEmpty()) throw new IllegalArgumentException("Empty identifier");
    List<String> out = new ArrayList<>();
    for (String part : p.split("\\.")) {
      String s = part.trim();
      out.add("*".equals(s) ? s : quoteIdent(s));
    }
    return String.join(".", out);
  }

  protected abstract String quoteIdent(String ident);
}
