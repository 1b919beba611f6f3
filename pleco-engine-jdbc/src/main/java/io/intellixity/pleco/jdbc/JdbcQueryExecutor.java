package io.intellixity.pleco.jdbc;

import io.intellixity.pleco.querybuilder.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;

/** Runs built statements on a {@link DataSource}. */
public final class JdbcQueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private final DataSource ds;

  public JdbcQueryExecutor(DataSource ds) {
    this.ds = Objects.requireNonNull(ds, "ds");
  }

  public List<Map<String, Object>> query(QueryBuilder<SqlStatement> query) {
    return query(query.build());
  }

  /** Rows as column-label to value maps, in result-set column order. */
  public List<Map<String, Object>> query(SqlStatement ss) {
    return query(ss, JdbcQueryExecutor::toMap);
  }

  public <T> List<T> query(SqlStatement ss, RowMapper<T> mapper) {
    Objects.requireNonNull(ss, "ss");
    Objects.requireNonNull(mapper, "mapper");
    String jdbcSql = ss.jdbcSql();
    long start = System.nanoTime();
    debugSql("SELECT", ss, jdbcSql);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(mapper.map(rs));
        debugDone("SELECT", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("Query failed: " + e.getMessage(), e);
    }
  }

  /** Row count of a statement; pass an unpaged statement for a total. */
  public long count(SqlStatement ss) {
    Objects.requireNonNull(ss, "ss");
    SqlStatement counted = new SqlStatement("SELECT COUNT(1) FROM (" + ss.sql() + ") pleco_count", ss.binds());
    String jdbcSql = counted.jdbcSql();
    long start = System.nanoTime();
    debugSql("COUNT", counted, jdbcSql);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, counted);
      try (ResultSet rs = ps.executeQuery()) {
        long v = rs.next() ? rs.getLong(1) : 0;
        debugDone("COUNT", v, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw new QueryExecutionException("Count failed: " + e.getMessage(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      Object v = ss.binds().get(i);
      if (v instanceof Enum<?> e) v = e.name();
      else if (v instanceof Character ch) v = String.valueOf(ch);
      ps.setObject(i + 1, v);
    }
  }

  private static Map<String, Object> toMap(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      row.put(md.getColumnLabel(i), rs.getObject(i));
    }
    return row;
  }

  private static void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("pleco.jdbc op={} bindCount={} sql={}", op, ss.binds().size(), jdbcSql);

    // TRACE: bind types only, never values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        log.trace("pleco.jdbc bind index={} valueType={}", idx++, v == null ? "null" : v.getClass().getName());
      }
    }
  }

  private static void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("pleco.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
