package io.intellixity.pleco.query;

import java.util.Map;
import java.util.Objects;

public record SortField(String field, SortDirection direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? SortDirection.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, SortDirection.ASC); }
  public static SortField desc(String field) { return new SortField(field, SortDirection.DESC); }

  /**
   * Sort input of the form {@code {field: "ASC"|"DESC"}}. Only the first entry is honored; an absent or empty
   * map yields {@code null}.
   */
  public static SortField fromMap(Map<String, ?> sort) {
    if (sort == null || sort.isEmpty()) return null;
    Map.Entry<String, ?> first = sort.entrySet().iterator().next();
    Object dir = first.getValue();
    SortDirection d = (dir instanceof SortDirection sd) ? sd : SortDirection.parse(dir == null ? null : String.valueOf(dir));
    return new SortField(first.getKey(), d);
  }
}
