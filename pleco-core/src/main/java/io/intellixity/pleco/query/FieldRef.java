package io.intellixity.pleco.query;

import java.util.Objects;

/**
 * Constraint on a named field. The field is either a virtual field backed by a registered subquery or,
 * failing that, a column of the table being filtered.
 */
public final class FieldRef implements FilterNode {
  private final String field;
  private final FilterNode subfilter;

  public FieldRef(String field, FilterNode subfilter) {
    this.field = Objects.requireNonNull(field, "field");
    this.subfilter = Objects.requireNonNull(subfilter, "subfilter");
  }

  public String field() { return field; }
  public FilterNode subfilter() { return subfilter; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FieldRef f)) return false;
    return field.equals(f.field) && subfilter.equals(f.subfilter);
  }

  @Override
  public int hashCode() { return Objects.hash(field, subfilter); }

  @Override
  public String toString() { return field + ":" + subfilter; }
}
