package io.intellixity.pleco.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Map;

/** Request envelope carrying the filter, sort and page of a list query. Any part may be absent. */
@JsonSerialize(using = ListQueryJsonSerializer.class)
@JsonDeserialize(using = ListQueryJsonDeserializer.class)
public final class ListQuery {
  private FilterNode filter;
  private SortField sort;
  private LimitOffsetPage page;

  public ListQuery() {}

  public FilterNode filter() { return filter; }
  public SortField sort() { return sort; }
  public LimitOffsetPage page() { return page; }

  public ListQuery withFilter(FilterNode filter) { this.filter = filter; return this; }
  /** Raw JSON-shaped filter; see {@link FilterParser}. */
  public ListQuery withFilter(Map<String, ?> filter) { this.filter = FilterParser.parse(filter); return this; }
  public ListQuery withSort(SortField sort) { this.sort = sort; return this; }
  public ListQuery withPage(LimitOffsetPage page) { this.page = page; return this; }

  public static ListQuery of(FilterNode filter) {
    return new ListQuery().withFilter(filter);
  }

  /**
   * JSON-shaped request body with optional {@code filter}, {@code sort} and {@code page} members.
   * Sort and page are read by {@link SortField#fromMap} and {@link LimitOffsetPage#fromMap}.
   */
  public static ListQuery fromMap(Map<String, ?> request) {
    ListQuery q = new ListQuery();
    if (request == null) return q;
    q.filter = FilterParser.parse(request.get("filter"));
    q.sort = SortField.fromMap(member(request, "sort"));
    q.page = LimitOffsetPage.fromMap(member(request, "page"));
    return q;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, ?> member(Map<String, ?> request, String name) {
    Object v = request.get(name);
    if (v == null) return null;
    if (!(v instanceof Map<?, ?>)) throw new IllegalArgumentException(name + " must be an object, got: " + v);
    return (Map<String, ?>) v;
  }
}
