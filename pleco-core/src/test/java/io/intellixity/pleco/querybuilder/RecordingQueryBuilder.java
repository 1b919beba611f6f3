package io.intellixity.pleco.querybuilder;

import io.intellixity.pleco.query.SortDirection;

import java.util.*;
import java.util.function.UnaryOperator;

/** Test double that records the calls made on it; {@link #build()} returns the call log. */
public final class RecordingQueryBuilder implements QueryBuilder<String> {
  private final List<String> calls;
  private String alias;

  public RecordingQueryBuilder() {
    this(new ArrayList<>(), null);
  }

  private RecordingQueryBuilder(List<String> calls, String alias) {
    this.calls = calls;
    this.alias = alias;
  }

  public static RecordingQueryBuilder table(String table) {
    RecordingQueryBuilder qb = new RecordingQueryBuilder();
    qb.from(table);
    return qb;
  }

  public String alias() { return alias; }

  @Override public QueryBuilder<String> select(String... columns) { return log("select(" + String.join(",", columns) + ")"); }
  @Override public QueryBuilder<String> from(String table) { return log("from(" + table + ")"); }
  @Override public QueryBuilder<String> from(QueryBuilder<String> subquery) { return log("from[" + subquery.build() + "]"); }

  @Override
  public QueryBuilder<String> as(String alias) {
    this.alias = alias;
    return log("as(" + alias + ")");
  }

  @Override
  public QueryBuilder<String> leftJoin(String table, String leftColumn, String rightColumn) {
    return log("leftJoin(" + table + "," + leftColumn + "," + rightColumn + ")");
  }

  @Override
  public QueryBuilder<String> leftJoin(QueryBuilder<String> subquery, String leftColumn, String rightColumn) {
    return log("leftJoin([" + subquery.build() + "]," + leftColumn + "," + rightColumn + ")");
  }

  @Override
  public QueryBuilder<String> where(String column, String operator, Object value) {
    return log("where(" + column + " " + operator + " " + value + ")");
  }

  @Override
  public QueryBuilder<String> where(UnaryOperator<QueryBuilder<String>> callback) {
    return log("where{" + callback.apply(new RecordingQueryBuilder()).build() + "}");
  }

  @Override
  public QueryBuilder<String> orWhere(UnaryOperator<QueryBuilder<String>> callback) {
    return log("orWhere{" + callback.apply(new RecordingQueryBuilder()).build() + "}");
  }

  @Override public QueryBuilder<String> whereIn(String column, Collection<?> values) { return log("whereIn(" + column + "," + values + ")"); }
  @Override public QueryBuilder<String> whereIn(String column, QueryBuilder<String> subquery) { return log("whereIn(" + column + ",(" + subquery.build() + "))"); }
  @Override public QueryBuilder<String> whereNotIn(String column, Collection<?> values) { return log("whereNotIn(" + column + "," + values + ")"); }
  @Override public QueryBuilder<String> whereNotIn(String column, QueryBuilder<String> subquery) { return log("whereNotIn(" + column + ",(" + subquery.build() + "))"); }
  @Override public QueryBuilder<String> whereNull(String column) { return log("whereNull(" + column + ")"); }
  @Override public QueryBuilder<String> whereNotNull(String column) { return log("whereNotNull(" + column + ")"); }
  @Override public QueryBuilder<String> whereRaw(String predicate, List<?> bindings) { return log("whereRaw(" + predicate + "," + bindings + ")"); }
  @Override public QueryBuilder<String> orderBy(String column, SortDirection direction) { return log("orderBy(" + column + "," + direction + ")"); }
  @Override public QueryBuilder<String> limit(int limit) { return log("limit(" + limit + ")"); }
  @Override public QueryBuilder<String> offset(int offset) { return log("offset(" + offset + ")"); }

  @Override
  public RecordingQueryBuilder clone() {
    return new RecordingQueryBuilder(new ArrayList<>(calls), alias);
  }

  @Override
  public RecordingQueryBuilder getNewInstance() {
    return new RecordingQueryBuilder();
  }

  @Override
  public String build() {
    return String.join(" ", calls);
  }

  private QueryBuilder<String> log(String call) {
    calls.add(call);
    return this;
  }
}
