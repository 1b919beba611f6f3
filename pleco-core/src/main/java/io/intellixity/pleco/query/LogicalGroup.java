package io.intellixity.pleco.query;

import java.util.*;

/** Explicit or implicit AND / OR over child filters, kept in input order. */
public final class LogicalGroup implements FilterNode {
  private final Clause clause;
  private final List<FilterNode> elements;

  public LogicalGroup(Clause clause, List<FilterNode> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<FilterNode> elements() { return elements; }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup g)) return false;
    return clause == g.clause && elements.equals(g.elements);
  }

  @Override
  public int hashCode() { return Objects.hash(clause, elements); }

  @Override
  public String toString() { return clause + elements.toString(); }
}
