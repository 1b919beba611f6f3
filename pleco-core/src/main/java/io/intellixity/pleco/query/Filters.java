package io.intellixity.pleco.query;

import java.util.*;

public final class Filters {
  private Filters() {}

  public static Condition eq(Object value) { return new Condition(Operator.EQ, value); }
  public static Condition ne(Object value) { return new Condition(Operator.NE, value); }
  public static Condition gt(Object value) { return new Condition(Operator.GT, value); }
  public static Condition gte(Object value) { return new Condition(Operator.GTE, value); }
  public static Condition lt(Object value) { return new Condition(Operator.LT, value); }
  public static Condition lte(Object value) { return new Condition(Operator.LTE, value); }

  public static Condition in(Collection<?> values) { return new Condition(Operator.IN, values); }
  public static Condition nin(Collection<?> values) { return new Condition(Operator.NIN, values); }

  /** Case-insensitive substring match. */
  public static Condition contains(String pattern) { return new Condition(Operator.CONTAINS, pattern); }

  public static FieldRef field(String field, FilterNode subfilter) {
    return new FieldRef(field, subfilter);
  }

  public static LogicalGroup and(FilterNode... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(FilterNode... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }
}
