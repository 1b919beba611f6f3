package io.intellixity.pleco.querybuilder;

import io.intellixity.pleco.query.SortDirection;

import java.util.Collection;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Minimal fluent builder the compilers are written against. Each backend (SQL dialect, query library)
 * implements it independently; an instance represents one statement under construction.
 * <p>
 * Every method mutates the receiver and returns it (or, for {@link #clone()} and {@link #getNewInstance()},
 * a new instance that shares no mutable state with the receiver).
 *
 * @param <T> the concrete statement type produced by {@link #build()}
 */
public interface QueryBuilder<T> {
  /** Add projected columns; {@code "t.col as alias"} and {@code "t.*"} are accepted. */
  QueryBuilder<T> select(String... columns);

  QueryBuilder<T> from(String table);

  /** Select from a derived table. The subquery should carry an alias ({@link #as(String)}). */
  QueryBuilder<T> from(QueryBuilder<T> subquery);

  /** Alias used when this builder is embedded in another one. */
  QueryBuilder<T> as(String alias);

  QueryBuilder<T> leftJoin(String table, String leftColumn, String rightColumn);

  QueryBuilder<T> leftJoin(QueryBuilder<T> subquery, String leftColumn, String rightColumn);

  /** {@code column <operator> value}; operator is one of {@code = <> != > < >= <=}. */
  QueryBuilder<T> where(String column, String operator, Object value);

  /**
   * Conjoin a parenthesized sub-predicate. The callback receives a fresh builder scoped to the sub-predicate
   * and must return it; an empty sub-predicate contributes nothing.
   */
  QueryBuilder<T> where(UnaryOperator<QueryBuilder<T>> callback);

  /** Same as {@link #where(UnaryOperator)} but disjoined with the predicate built so far. */
  QueryBuilder<T> orWhere(UnaryOperator<QueryBuilder<T>> callback);

  QueryBuilder<T> whereIn(String column, Collection<?> values);

  /** IN-list sourced from a subquery; the subquery's built form is embedded. */
  QueryBuilder<T> whereIn(String column, QueryBuilder<T> subquery);

  QueryBuilder<T> whereNotIn(String column, Collection<?> values);

  QueryBuilder<T> whereNotIn(String column, QueryBuilder<T> subquery);

  QueryBuilder<T> whereNull(String column);

  QueryBuilder<T> whereNotNull(String column);

  /**
   * Raw predicate. {@code ??} marks an identifier binding, {@code ?} a value binding; bindings are consumed in
   * order and must be passed to the engine as parameters, never concatenated.
   */
  QueryBuilder<T> whereRaw(String predicate, List<?> bindings);

  QueryBuilder<T> orderBy(String column, SortDirection direction);

  QueryBuilder<T> limit(int limit);

  QueryBuilder<T> offset(int offset);

  /** Copy such that further mutation of either instance is invisible to the other. */
  QueryBuilder<T> clone();

  /** Empty builder bound to the same connection/dialect. */
  QueryBuilder<T> getNewInstance();

  /** Materialize the statement for execution by the caller. */
  T build();
}
