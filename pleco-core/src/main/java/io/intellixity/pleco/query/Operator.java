package io.intellixity.pleco.query;

import java.util.Locale;

public enum Operator {
  IN("in"),
  NIN("nin"),
  EQ("eq"),
  NE("ne"),
  GT("gt"),
  LT("lt"),
  GTE("gte"),
  LTE("lte"),

  // string-valued fields only
  CONTAINS("contains");

  private final String key;

  Operator(String key) {
    this.key = key;
  }

  /** Key used for this operator in filter JSON. */
  public String key() {
    return key;
  }

  public boolean isList() {
    return this == IN || this == NIN;
  }

  public boolean isOrdered() {
    return this == GT || this == LT || this == GTE || this == LTE;
  }

  /** Operator for a filter key, or {@code null} when the key is not an operator (i.e. a field name). */
  public static Operator fromKey(String key) {
    if (key == null) return null;
    for (Operator op : values()) {
      if (op.key.equals(key)) return op;
    }
    return null;
  }

  @Override
  public String toString() {
    return key.toLowerCase(Locale.ROOT);
  }
}
