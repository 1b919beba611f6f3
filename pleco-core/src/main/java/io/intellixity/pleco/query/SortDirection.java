package io.intellixity.pleco.query;

import java.util.Locale;

public enum SortDirection {
  ASC,
  DESC;

  /** Case-insensitive parse of {@code asc}/{@code desc}. */
  public static SortDirection parse(String s) {
    if (s == null) throw new IllegalArgumentException("sort direction is required");
    try {
      return valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown sort direction: " + s, e);
    }
  }
}
