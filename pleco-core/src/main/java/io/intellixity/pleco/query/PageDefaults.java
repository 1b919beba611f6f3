package io.intellixity.pleco.query;

/** Defaults merged into a {@link LimitOffsetPage} before it is applied. */
public record PageDefaults(int offset) {
  public static final PageDefaults DEFAULT = new PageDefaults(0);
}
