package io.intellixity.pleco.compile;

import io.intellixity.pleco.query.ListQuery;
import io.intellixity.pleco.querybuilder.QueryBuilder;
import io.intellixity.pleco.querybuilder.SubqueryRegistry;

import java.util.Objects;

/** Applies filter, then sort, then page of a {@link ListQuery} to a base query. */
public final class QueryCompiler {
  private final CompilerOptions options;
  private final FilterCompiler filters;
  private final SortCompiler sorts;
  private final PageCompiler pages;

  public QueryCompiler() {
    this(CompilerOptions.DEFAULT);
  }

  public QueryCompiler(CompilerOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.filters = new FilterCompiler(options);
    this.sorts = new SortCompiler(options);
    this.pages = new PageCompiler(options.pageDefaults());
  }

  public CompilerOptions options() { return options; }
  public FilterCompiler filters() { return filters; }
  public SortCompiler sorts() { return sorts; }
  public PageCompiler pages() { return pages; }

  public <T> QueryBuilder<T> compile(ListQuery query, SubqueryRegistry<T> subqueries, QueryBuilder<T> base) {
    Objects.requireNonNull(base, "base");
    if (query == null) return base;
    QueryBuilder<T> out = filters.compile(query.filter(), subqueries, base);
    out = sorts.compile(query.sort(), subqueries, out);
    return pages.compile(query.page(), out);
  }
}
