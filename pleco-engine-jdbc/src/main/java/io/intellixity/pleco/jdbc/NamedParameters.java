package io.intellixity.pleco.jdbc;

/**
 * Rewrites SQL containing named parameters ({@code :b1}, {@code :tenantId}) into JDBC SQL with {@code ?}.
 * <p>
 * Rules:
 * <ul>
 *   <li>a parameter is {@code ':'} followed by {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>{@code '::'} is a Postgres cast, not a parameter</li>
 *   <li>text inside single quotes or double-quoted identifiers is copied as is</li>
 * </ul>
 */
public final class NamedParameters {
  private NamedParameters() {}

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length());
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // doubled quote is an escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
