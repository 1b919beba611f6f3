package io.intellixity.pleco.compile;

import io.intellixity.pleco.query.LimitOffsetPage;
import io.intellixity.pleco.query.PageDefaults;
import io.intellixity.pleco.querybuilder.QueryBuilder;

import java.util.Map;
import java.util.Objects;

/** Applies limit/offset paging. The offset is always applied (default from {@link PageDefaults}). */
public final class PageCompiler {
  private final PageDefaults defaults;

  public PageCompiler() {
    this(PageDefaults.DEFAULT);
  }

  public PageCompiler(PageDefaults defaults) {
    this.defaults = Objects.requireNonNull(defaults, "defaults");
  }

  public <T> QueryBuilder<T> compile(Map<String, ?> page, QueryBuilder<T> query) {
    return compile(LimitOffsetPage.fromMap(page), query);
  }

  public <T> QueryBuilder<T> compile(LimitOffsetPage page, QueryBuilder<T> query) {
    Objects.requireNonNull(query, "query");
    if (page == null) return query;

    int offset = (page.offset() == null) ? defaults.offset() : page.offset();
    query.offset(offset);
    if (page.limit() != null) query.limit(page.limit());
    return query;
  }
}
