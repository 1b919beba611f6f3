package io.intellixity.pleco.schema;

import io.intellixity.pleco.query.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * GraphQL SDL for the filter input types ({@code FilterQuery_<Scalar>}), the {@code SortDirection} enum and
 * the {@code LimitOffsetPage} input, for inclusion in a schema that exposes list queries.
 */
public final class GraphQLFilterTypes {
  private GraphQLFilterTypes() {}

  public static String filterInputName(ScalarType type) {
    return "FilterQuery_" + type.graphQLName();
  }

  public static String filterInput(ScalarType type) {
    String scalar = type.graphQLName();
    String self = filterInputName(type);
    StringBuilder sb = new StringBuilder("input ").append(self).append(" {\n");
    for (Operator op : type.operators()) {
      if (op == Operator.CONTAINS) continue;
      sb.append("  ").append(op.key()).append(": ").append(op.isList() ? "[" + scalar + "]" : scalar).append('\n');
    }
    sb.append("  AND: [").append(self).append("]\n");
    sb.append("  OR: [").append(self).append("]\n");
    if (type.allows(Operator.CONTAINS)) sb.append("  contains: ").append(scalar).append('\n');
    return sb.append('}').toString();
  }

  public static String sortDirection() {
    return "enum SortDirection {\n  ASC\n  DESC\n}";
  }

  public static String limitOffsetPage() {
    return "input LimitOffsetPage {\n  limit: Int\n  offset: Int\n}";
  }

  /** All types, in the order Boolean, Float, ID, Int, String, SortDirection, LimitOffsetPage. */
  public static List<String> all() {
    List<String> out = new ArrayList<>();
    for (ScalarType t : List.of(ScalarType.BOOLEAN, ScalarType.FLOAT, ScalarType.ID, ScalarType.INT, ScalarType.STRING)) {
      out.add(filterInput(t));
    }
    out.add(sortDirection());
    out.add(limitOffsetPage());
    return out;
  }

  public static String sdl() {
    return String.join("\n\n", all()) + "\n";
  }
}
