package io.intellixity.pleco.querybuilder;

import java.util.*;

/**
 * Virtual-field subqueries by field name.
 * <p>
 * Every registered subquery must project three columns named exactly:
 * <ul>
 *   <li>{@value #RESOURCE_ID}: id of the resource, equal to the base table's id column</li>
 *   <li>{@value #VALUE}: the value filters compare against</li>
 *   <li>{@value #SORT}: the value sorting orders by (often the same as {@value #VALUE})</li>
 * </ul>
 * Subqueries should return a row for every base row (defaults or NULLs where nothing applies), otherwise
 * rows without a subquery row can never match a filter on that field.
 * <p>
 * The registry is read-only to the compilers: entries are cloned before being aliased or embedded.
 */
public final class SubqueryRegistry<T> {
  public static final String RESOURCE_ID = "resource_id";
  public static final String VALUE = "value";
  public static final String SORT = "sort";

  private final Map<String, QueryBuilder<T>> subqueries;

  private SubqueryRegistry(Map<String, QueryBuilder<T>> subqueries) {
    this.subqueries = Collections.unmodifiableMap(new LinkedHashMap<>(subqueries));
  }

  public static <T> SubqueryRegistry<T> empty() {
    return new SubqueryRegistry<>(Map.of());
  }

  public static <T> SubqueryRegistry<T> of(Map<String, ? extends QueryBuilder<T>> subqueries) {
    Map<String, QueryBuilder<T>> m = new LinkedHashMap<>();
    if (subqueries != null) {
      for (var e : subqueries.entrySet()) {
        m.put(Objects.requireNonNull(e.getKey(), "field"), Objects.requireNonNull(e.getValue(), e.getKey()));
      }
    }
    return new SubqueryRegistry<>(m);
  }

  /** Registered subquery for a field, or {@code null}. */
  public QueryBuilder<T> lookup(String field) {
    return subqueries.get(field);
  }

  public boolean contains(String field) {
    return subqueries.containsKey(field);
  }

  public Set<String> fields() {
    return subqueries.keySet();
  }

  /** New registry with {@code other}'s entries added; {@code other} wins on duplicate fields. */
  public SubqueryRegistry<T> merge(SubqueryRegistry<T> other) {
    if (other == null || other.subqueries.isEmpty()) return this;
    Map<String, QueryBuilder<T>> m = new LinkedHashMap<>(subqueries);
    m.putAll(other.subqueries);
    return new SubqueryRegistry<>(m);
  }

  public SubqueryRegistry<T> with(String field, QueryBuilder<T> subquery) {
    Map<String, QueryBuilder<T>> m = new LinkedHashMap<>(subqueries);
    m.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(subquery, "subquery"));
    return new SubqueryRegistry<>(m);
  }
}
