package io.intellixity.pleco.query;

public enum Clause {
  AND,
  OR
}
