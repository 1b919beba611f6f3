package io.intellixity.pleco.query;

/** A node of a normalized filter tree. The set of node kinds is closed; see {@link FilterVisitor}. */
public interface FilterNode {
  <R> R accept(FilterVisitor<R> visitor);
}
