package io.intellixity.pleco.jdbc;

import io.intellixity.pleco.jdbc.dialect.SqlDialect;
import io.intellixity.pleco.querybuilder.SubqueryRegistry;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

/**
 * Derives one virtual-field subquery per column of a table:
 * <pre>
 * SELECT "id" AS "resource_id", "col" AS "value", "col" AS "sort" FROM "table"
 * </pre>
 * Field names are the camel-cased column names ({@code zero_to_sixty -> zeroToSixty}), so API fields can
 * differ from storage columns without registering each one by hand.
 */
public final class ColumnSubqueries {
  private ColumnSubqueries() {}

  public static SubqueryRegistry<SqlStatement> forColumns(SqlDialect dialect, String table, String idColumn,
                                                          Collection<String> columns) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(idColumn, "idColumn");
    Map<String, SqlQueryBuilder> out = new LinkedHashMap<>();
    for (String col : columns) {
      out.put(camelCase(col), SqlQueryBuilder.table(dialect, table).select(
          idColumn + " as " + SubqueryRegistry.RESOURCE_ID,
          col + " as " + SubqueryRegistry.VALUE,
          col + " as " + SubqueryRegistry.SORT));
    }
    return SubqueryRegistry.of(out);
  }

  /** Reads the column list of {@code table} from JDBC metadata. */
  public static SubqueryRegistry<SqlStatement> forTable(DataSource ds, SqlDialect dialect, String table, String idColumn) {
    return forColumns(dialect, table, idColumn, columnNames(ds, table));
  }

  public static List<String> columnNames(DataSource ds, String table) {
    try (Connection c = ds.getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      List<String> out = new ArrayList<>();
      try (ResultSet rs = md.getColumns(c.getCatalog(), null, table, null)) {
        while (rs.next()) out.add(rs.getString("COLUMN_NAME"));
      }
      if (out.isEmpty()) throw new IllegalArgumentException("No columns found for table: " + table);
      return out;
    } catch (SQLException e) {
      throw new QueryExecutionException("Failed to read columns of table " + table, e);
    }
  }

  static String camelCase(String column) {
    StringBuilder sb = new StringBuilder(column.length());
    boolean upper = false;
    for (int i = 0; i < column.length(); i++) {
      char ch = column.charAt(i);
      if (ch == '_' || ch == '-' || ch == ' ') {
        upper = sb.length() > 0;
        continue;
      }
      sb.append(upper ? Character.toUpperCase(ch) : ch);
      upper = false;
    }
    return sb.toString();
  }
}
