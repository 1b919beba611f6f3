package io.intellixity.pleco.compile;

import io.intellixity.pleco.query.SortField;
import io.intellixity.pleco.querybuilder.QueryBuilder;
import io.intellixity.pleco.querybuilder.SubqueryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Applies a single-field sort.
 * <p>
 * A field with a registered subquery cannot simply be joined and ordered on: a DISTINCT base query would need
 * the sort column in its projection. Instead the base query is wrapped:
 * <pre>
 * SELECT subquery.* FROM (&lt;query&gt;) AS subquery
 *   LEFT JOIN (&lt;sort subquery&gt;) AS subquery_sort ON subquery.id = subquery_sort.resource_id
 *   ORDER BY subquery_sort.sort &lt;direction&gt;
 * </pre>
 * which keeps exactly the base query's columns. Other fields are ordered on directly.
 */
public final class SortCompiler {
  private static final Logger log = LoggerFactory.getLogger(SortCompiler.class);

  public static final String WRAPPED_ALIAS = "subquery";
  public static final String SORT_ALIAS = "subquery_sort";

  private final CompilerOptions options;

  public SortCompiler() {
    this(CompilerOptions.DEFAULT);
  }

  public SortCompiler(CompilerOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Compile {@code {field: "ASC"|"DESC"}} input; only the first entry is honored. */
  public <T> QueryBuilder<T> compile(Map<String, ?> sort, SubqueryRegistry<T> subqueries, QueryBuilder<T> query) {
    return compile(SortField.fromMap(sort), subqueries, query);
  }

  public <T> QueryBuilder<T> compile(SortField sort, SubqueryRegistry<T> subqueries, QueryBuilder<T> query) {
    Objects.requireNonNull(query, "query");
    if (sort == null) return query;

    String field = sort.field();
    QueryBuilder<T> sortSubquery = (subqueries == null) ? null : subqueries.lookup(field);

    if (sortSubquery == null) {
      if (options.unknownFieldPolicy() == UnknownFieldPolicy.REJECT) {
        throw new MissingSubqueryException(field, "sort");
      }
      log.debug("pleco.sort field={} direction={} mode=column", field, sort.direction());
      return query.orderBy(field, sort.direction());
    }

    log.debug("pleco.sort field={} direction={} mode=subquery", field, sort.direction());
    return query.getNewInstance()
        .select(WRAPPED_ALIAS + ".*")
        .from(query.as(WRAPPED_ALIAS))
        .leftJoin(sortSubquery.clone().as(SORT_ALIAS),
            WRAPPED_ALIAS + "." + options.resourceIdColumn(),
            SORT_ALIAS + "." + SubqueryRegistry.RESOURCE_ID)
        .orderBy(SORT_ALIAS + "." + SubqueryRegistry.SORT, sort.direction());
  }
}
