package io.intellixity.pleco.jdbc;

import io.intellixity.pleco.jdbc.dialect.SqlDialect;
import io.intellixity.pleco.query.SortDirection;
import io.intellixity.pleco.querybuilder.QueryBuilder;
import io.intellixity.pleco.querybuilder.QueryConfigurationException;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * {@link QueryBuilder} over an in-memory SELECT model, rendered to a {@link SqlStatement}.
 * <p>
 * Values are never concatenated into SQL: every value becomes a named placeholder ({@code :b1 .. :bn}, in
 * the order they appear in the statement). Embedded subqueries are snapshotted, so changing a builder after
 * passing it to {@code from}/{@code leftJoin}/{@code whereIn} does not affect this one.
 * <p>
 * Raw fragments ({@link #whereRaw}, {@link #selectRaw}) use {@code ??} for identifiers (quoted by the
 * dialect) and {@code ?} for values (bound).
 */
public final class SqlQueryBuilder implements QueryBuilder<SqlStatement> {
  private static final Set<String> COMPARISONS = Set.of("=", "<>", "!=", ">", "<", ">=", "<=", "LIKE");

  private final SqlDialect dialect;
  private boolean distinct;
  private final List<SelectItem> select = new ArrayList<>();
  private String fromTable;
  private SqlQueryBuilder fromSubquery;
  private String alias;
  private final List<Join> joins = new ArrayList<>();
  private final List<Term> where = new ArrayList<>();
  private final List<Order> orders = new ArrayList<>();
  private Integer limit;
  private Integer offset;

  /**
   * @param dialect dialect to render with; may be {@code null} when a seed is given
   * @param seed    builder whose state is copied; may be {@code null} when a dialect is given
   */
  public SqlQueryBuilder(SqlDialect dialect, SqlQueryBuilder seed) {
    if (dialect == null && seed == null) {
      throw new QueryConfigurationException("SqlQueryBuilder requires a dialect or a seed query");
    }
    this.dialect = (dialect != null) ? dialect : seed.dialect;
    if (seed != null) {
      this.distinct = seed.distinct;
      this.select.addAll(seed.select);
      this.fromTable = seed.fromTable;
      this.fromSubquery = seed.fromSubquery;
      this.alias = seed.alias;
      this.joins.addAll(seed.joins);
      this.where.addAll(seed.where);
      this.orders.addAll(seed.orders);
      this.limit = seed.limit;
      this.offset = seed.offset;
    }
  }

  public static SqlQueryBuilder of(SqlDialect dialect) {
    return new SqlQueryBuilder(dialect, null);
  }

  /** {@code SELECT * FROM table}. */
  public static SqlQueryBuilder table(SqlDialect dialect, String table) {
    SqlQueryBuilder qb = of(dialect);
    qb.from(table);
    return qb;
  }

  public SqlDialect dialect() { return dialect; }
  public String alias() { return alias; }

  @Override
  public SqlQueryBuilder select(String... columns) {
    for (String c : columns) select.add(new SelectItem(Objects.requireNonNull(c, "column"), null, List.of()));
    return this;
  }

  /** {@code SELECT DISTINCT}; adds {@code columns} to the select list. */
  public SqlQueryBuilder distinct(String... columns) {
    distinct = true;
    return select(columns);
  }

  /** Raw select item, e.g. {@code selectRaw("?? as value", List.of("year"))}. */
  public SqlQueryBuilder selectRaw(String expression, List<?> bindings) {
    select.add(new SelectItem(null, Objects.requireNonNull(expression, "expression"), copy(bindings)));
    return this;
  }

  @Override
  public SqlQueryBuilder from(String table) {
    fromTable = Objects.requireNonNull(table, "table");
    fromSubquery = null;
    return this;
  }

  @Override
  public SqlQueryBuilder from(QueryBuilder<SqlStatement> subquery) {
    fromSubquery = snapshot(subquery);
    fromTable = null;
    return this;
  }

  @Override
  public SqlQueryBuilder as(String alias) {
    this.alias = Objects.requireNonNull(alias, "alias");
    return this;
  }

  @Override
  public SqlQueryBuilder leftJoin(String table, String leftColumn, String rightColumn) {
    joins.add(new Join(Objects.requireNonNull(table, "table"), null, leftColumn, rightColumn));
    return this;
  }

  @Override
  public SqlQueryBuilder leftJoin(QueryBuilder<SqlStatement> subquery, String leftColumn, String rightColumn) {
    joins.add(new Join(null, snapshot(subquery), leftColumn, rightColumn));
    return this;
  }

  @Override
  public SqlQueryBuilder where(String column, String operator, Object value) {
    Objects.requireNonNull(column, "column");
    String op = Objects.requireNonNull(operator, "operator").trim().toUpperCase(Locale.ROOT);
    if (!COMPARISONS.contains(op)) throw new IllegalArgumentException("Unsupported operator: " + operator);
    if ("!=".equals(op)) op = "<>";

    if (value == null) {
      if ("=".equals(op)) return and(new NullCheck(column, true));
      if ("<>".equals(op)) return and(new NullCheck(column, false));
      throw new IllegalArgumentException(op + " requires non-null value");
    }
    return and(new Compare(column, op, value));
  }

  @Override
  public SqlQueryBuilder where(UnaryOperator<QueryBuilder<SqlStatement>> callback) {
    return and(nested(callback));
  }

  @Override
  public SqlQueryBuilder orWhere(UnaryOperator<QueryBuilder<SqlStatement>> callback) {
    where.add(new Term(true, nested(callback)));
    return this;
  }

  @Override
  public SqlQueryBuilder whereIn(String column, Collection<?> values) {
    return and(new InList(column, copy(values), false));
  }

  @Override
  public SqlQueryBuilder whereIn(String column, QueryBuilder<SqlStatement> subquery) {
    return and(new InSubquery(column, snapshot(subquery), false));
  }

  @Override
  public SqlQueryBuilder whereNotIn(String column, Collection<?> values) {
    return and(new InList(column, copy(values), true));
  }

  @Override
  public SqlQueryBuilder whereNotIn(String column, QueryBuilder<SqlStatement> subquery) {
    return and(new InSubquery(column, snapshot(subquery), true));
  }

  @Override
  public SqlQueryBuilder whereNull(String column) {
    return and(new NullCheck(column, true));
  }

  @Override
  public SqlQueryBuilder whereNotNull(String column) {
    return and(new NullCheck(column, false));
  }

  @Override
  public SqlQueryBuilder whereRaw(String predicate, List<?> bindings) {
    return and(new Raw(Objects.requireNonNull(predicate, "predicate"), copy(bindings)));
  }

  @Override
  public SqlQueryBuilder orderBy(String column, SortDirection direction) {
    orders.add(new Order(Objects.requireNonNull(column, "column"), direction == null ? SortDirection.ASC : direction));
    return this;
  }

  @Override
  public SqlQueryBuilder limit(int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    this.limit = limit;
    return this;
  }

  @Override
  public SqlQueryBuilder offset(int offset) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    this.offset = offset;
    return this;
  }

  @Override
  public SqlQueryBuilder clone() {
    return new SqlQueryBuilder(dialect, this);
  }

  @Override
  public SqlQueryBuilder getNewInstance() {
    return of(dialect);
  }

  @Override
  public SqlStatement build() {
    RenderCtx ctx = new RenderCtx();
    String sql = render(ctx);
    return new SqlStatement(sql, ctx.binds);
  }

  @Override
  public String toString() {
    if (fromTable == null && fromSubquery == null) return "SqlQueryBuilder{no source}";
    return build().sql();
  }

  // ---- model ----

  private interface Predicate {}

  private record Compare(String column, String op, Object value) implements Predicate {}
  private record NullCheck(String column, boolean isNull) implements Predicate {}
  private record InList(String column, List<Object> values, boolean not) implements Predicate {}
  private record InSubquery(String column, SqlQueryBuilder subquery, boolean not) implements Predicate {}
  private record Raw(String sql, List<Object> bindings) implements Predicate {}
  private record Group(List<Term> terms) implements Predicate {}

  private record Term(boolean or, Predicate predicate) {}
  private record SelectItem(String column, String raw, List<Object> bindings) {}
  private record Join(String table, SqlQueryBuilder subquery, String leftColumn, String rightColumn) {}
  private record Order(String column, SortDirection direction) {}

  private SqlQueryBuilder and(Predicate p) {
    where.add(new Term(false, p));
    return this;
  }

  private Group nested(UnaryOperator<QueryBuilder<SqlStatement>> callback) {
    Objects.requireNonNull(callback, "callback");
    SqlQueryBuilder scratch = of(dialect);
    QueryBuilder<SqlStatement> out = callback.apply(scratch);
    SqlQueryBuilder result = (out == null) ? scratch : adopt(out);
    return new Group(List.copyOf(result.where));
  }

  private static SqlQueryBuilder snapshot(QueryBuilder<SqlStatement> subquery) {
    return adopt(Objects.requireNonNull(subquery, "subquery")).clone();
  }

  private static SqlQueryBuilder adopt(QueryBuilder<SqlStatement> qb) {
    if (qb instanceof SqlQueryBuilder s) return s;
    throw new QueryConfigurationException("Cannot embed " + qb.getClass().getName() + " in a SqlQueryBuilder");
  }

  private static List<Object> copy(Collection<?> values) {
    if (values == null) return List.of();
    return Collections.unmodifiableList(new ArrayList<>(values));
  }

  // ---- rendering ----

  private static final class RenderCtx {
    private int n = 1;
    private final List<Object> binds = new ArrayList<>();

    String add(Object value) {
      binds.add(value);
      return ":b" + (n++);
    }
  }

  private String render(RenderCtx ctx) {
    if (fromTable == null && fromSubquery == null) {
      throw new QueryConfigurationException("Query has no FROM source");
    }

    StringBuilder sql = new StringBuilder("SELECT ");
    if (distinct) sql.append("DISTINCT ");
    sql.append(renderSelect(ctx));
    sql.append(" FROM ").append(renderSource(fromTable, fromSubquery, ctx));

    for (Join j : joins) {
      sql.append(" LEFT JOIN ").append(renderSource(j.table(), j.subquery(), ctx))
          .append(" ON ").append(dialect.quoteRef(j.leftColumn()))
          .append(" = ").append(dialect.quoteRef(j.rightColumn()));
    }

    String predicate = renderTerms(where, ctx);
    if (!predicate.isEmpty()) sql.append(" WHERE ").append(predicate);

    if (!orders.isEmpty()) {
      List<String> parts = new ArrayList<>(orders.size());
      for (Order o : orders) parts.add(dialect.quoteRef(o.column()) + " " + o.direction().name());
      sql.append(" ORDER BY ").append(String.join(", ", parts));
    }

    return (limit == null && offset == null) ? sql.toString() : dialect.applyPage(sql.toString(), limit, offset);
  }

  private String renderSelect(RenderCtx ctx) {
    if (select.isEmpty()) return "*";
    List<String> items = new ArrayList<>(select.size());
    for (SelectItem s : select) {
      items.add(s.raw() == null ? dialect.quoteRef(s.column()) : renderRaw(s.raw(), s.bindings(), ctx));
    }
    return String.join(", ", items);
  }

  private String renderSource(String table, SqlQueryBuilder subquery, RenderCtx ctx) {
    if (table != null) return dialect.quoteRef(table);
    if (subquery.alias == null) {
      throw new QueryConfigurationException("Subquery used as a source requires an alias");
    }
    return "(" + subquery.render(ctx) + ") AS " + dialect.quoteRef(subquery.alias);
  }

  private String renderTerms(List<Term> terms, RenderCtx ctx) {
    StringBuilder out = new StringBuilder();
    for (Term t : terms) {
      String s = renderPredicate(t.predicate(), ctx);
      if (s.isEmpty()) continue;
      if (out.length() > 0) out.append(t.or() ? " OR " : " AND ");
      out.append(s);
    }
    return out.toString();
  }

  // A group holding a single group renders once: ((a)) -> (a).
  private String renderGroup(Group g, RenderCtx ctx) {
    if (g.terms().size() == 1 && g.terms().get(0).predicate() instanceof Group inner) {
      return renderGroup(inner, ctx);
    }
    String s = renderTerms(g.terms(), ctx);
    return s.isEmpty() ? "" : "(" + s + ")";
  }

  private String renderPredicate(Predicate p, RenderCtx ctx) {
    if (p instanceof Group g) return renderGroup(g, ctx);
    if (p instanceof Compare c) return dialect.quoteRef(c.column()) + " " + c.op() + " " + ctx.add(c.value());
    if (p instanceof NullCheck n) return dialect.quoteRef(n.column()) + (n.isNull() ? " IS NULL" : " IS NOT NULL");
    if (p instanceof InList in) {
      if (in.values().isEmpty()) return in.not() ? "1 = 1" : "1 = 0";
      List<String> ph = new ArrayList<>(in.values().size());
      for (Object v : in.values()) ph.add(ctx.add(v));
      return dialect.quoteRef(in.column()) + (in.not() ? " NOT IN (" : " IN (") + String.join(", ", ph) + ")";
    }
    if (p instanceof InSubquery in) {
      return dialect.quoteRef(in.column()) + (in.not() ? " NOT IN (" : " IN (") + in.subquery().render(ctx) + ")";
    }
    if (p instanceof Raw r) return renderRaw(r.sql(), r.bindings(), ctx);
    throw new IllegalStateException("Unknown predicate: " + p);
  }

  private String renderRaw(String raw, List<Object> bindings, RenderCtx ctx) {
    StringBuilder out = new StringBuilder(raw.length() + 16);
    int next = 0;
    char quote = 0;

    for (int i = 0; i < raw.length(); i++) {
      char ch = raw.charAt(i);
      // literals and quoted identifiers are copied as is; a doubled quote toggles twice
      if (quote != 0) {
        if (ch == quote) quote = 0;
        out.append(ch);
        continue;
      }
      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }
      if (ch != '?') {
        out.append(ch);
        continue;
      }

      if (next >= bindings.size()) {
        throw new QueryConfigurationException("Raw SQL has more placeholders than bindings: " + raw);
      }
      Object b = bindings.get(next++);
      if (i + 1 < raw.length() && raw.charAt(i + 1) == '?') {
        if (b == null) throw new QueryConfigurationException("Identifier binding must not be null: " + raw);
        out.append(dialect.quoteRef(String.valueOf(b)));
        i++;
      } else {
        out.append(ctx.add(b));
      }
    }

    if (next != bindings.size()) {
      throw new QueryConfigurationException("Raw SQL expects " + next + " bindings, got " + bindings.size() + ": " + raw);
    }
    return out.toString();
  }
}
