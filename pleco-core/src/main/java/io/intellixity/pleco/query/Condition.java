package io.intellixity.pleco.query;

import java.util.*;

/**
 * Terminal operator applied to the active value column.
 * <p>
 * {@link Operator#IN}/{@link Operator#NIN} carry a list; {@code EQ}/{@code NE} may carry {@code null}
 * (rendered as IS NULL / IS NOT NULL).
 */
public final class Condition implements FilterNode {
  private final Operator operator;
  private final Object value;

  public Condition(Operator operator, Object value) {
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = operator.isList() ? Collections.unmodifiableList(new ArrayList<>(toList(value))) : value;
  }

  public Operator operator() { return operator; }
  public Object value() { return value; }

  @SuppressWarnings("unchecked")
  public List<Object> values() {
    if (!operator.isList()) throw new IllegalStateException(operator + " does not carry a value list");
    return (List<Object>) value;
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return operator == c.operator && Objects.equals(value, c.value);
  }

  @Override
  public int hashCode() { return Objects.hash(operator, value); }

  @Override
  public String toString() { return "{" + operator.key() + ": " + value + "}"; }

  private static Collection<?> toList(Object v) {
    if (v == null) throw new IllegalArgumentException("list operator requires values");
    if (v instanceof Collection<?> c) return c;
    if (v.getClass().isArray()) {
      int n = java.lang.reflect.Array.getLength(v);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(java.lang.reflect.Array.get(v, i));
      return out;
    }
    throw new IllegalArgumentException("list operator requires a collection, got " + v.getClass().getName());
  }
}
