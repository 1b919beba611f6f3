package io.intellixity.pleco.query;

public interface FilterVisitor<R> {
  R visit(LogicalGroup group);
  R visit(FieldRef field);
  R visit(Condition condition);
}
