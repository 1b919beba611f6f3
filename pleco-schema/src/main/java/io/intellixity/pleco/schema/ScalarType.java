package io.intellixity.pleco.schema;

import io.intellixity.pleco.query.Operator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/** Scalar types a filterable field can have, with the operators each one accepts. */
public enum ScalarType {
  BOOLEAN("Boolean"),
  ID("ID"),
  STRING("String"),
  INT("Int"),
  FLOAT("Float");

  private static final Set<Operator> BASIC = EnumSet.of(Operator.IN, Operator.NIN, Operator.EQ, Operator.NE);
  private static final Set<Operator> ORDERED = withOrdered(BASIC);
  private static final Set<Operator> TEXT = EnumSet.allOf(Operator.class);

  private static Set<Operator> withOrdered(Set<Operator> base) {
    Set<Operator> out = EnumSet.copyOf(base);
    for (Operator op : Operator.values()) {
      if (op.isOrdered()) out.add(op);
    }
    return out;
  }

  private final String graphQLName;

  ScalarType(String graphQLName) {
    this.graphQLName = graphQLName;
  }

  public String graphQLName() { return graphQLName; }

  public Set<Operator> operators() {
    return switch (this) {
      case BOOLEAN, ID -> Collections.unmodifiableSet(BASIC);
      case INT, FLOAT -> Collections.unmodifiableSet(ORDERED);
      case STRING -> Collections.unmodifiableSet(TEXT);
    };
  }

  public boolean allows(Operator op) {
    return operators().contains(op);
  }

  /** Whether a non-null JSON-shaped value is a literal of this type. */
  public boolean accepts(Object v) {
    if (v == null) return false;
    return switch (this) {
      case BOOLEAN -> v instanceof Boolean;
      case STRING -> v instanceof CharSequence;
      case ID -> v instanceof CharSequence || v instanceof UUID || isIntegral(v);
      case INT -> isIntegral(v);
      case FLOAT -> v instanceof Number;
    };
  }

  private static boolean isIntegral(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte || v instanceof BigInteger) {
      return true;
    }
    if (v instanceof BigDecimal bd) return bd.stripTrailingZeros().scale() <= 0;
    if (v instanceof Double || v instanceof Float) {
      double d = ((Number) v).doubleValue();
      return !Double.isInfinite(d) && d == Math.rint(d);
    }
    return false;
  }
}
