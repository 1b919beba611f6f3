package io.intellixity.pleco.query;

import java.lang.reflect.Array;
import java.time.temporal.TemporalAccessor;
import java.util.*;

/**
 * Normalizes JSON-shaped filter input ({@code Map}/{@code List}/scalars, as produced by Jackson or a GraphQL
 * layer) into a {@link FilterNode} tree.
 * <p>
 * Implicit forms are made explicit here so the compilers only ever see explicit nodes:
 * <ul>
 *   <li>a map with several keys becomes an AND group of single-key maps, in key order</li>
 *   <li>a bare array under a field becomes {@code in}</li>
 *   <li>a bare scalar under a field becomes {@code eq}</li>
 * </ul>
 * Keys other than {@code AND}, {@code OR} and operator keys are field names.
 */
public final class FilterParser {
  public static final String AND = "AND";
  public static final String OR = "OR";

  private FilterParser() {}

  /** Parse filter input. Returns {@code null} for absent or empty input (no constraint). */
  public static FilterNode parse(Object raw) {
    if (raw == null) return null;
    if (raw instanceof FilterNode n) return n;
    if (!(raw instanceof Map<?, ?> m)) {
      throw new MalformedFilterException("Filter must be an object, got " + typeName(raw));
    }
    return parseMap(m, "filter");
  }

  private static FilterNode parseMap(Map<?, ?> m, String path) {
    if (m.isEmpty()) return null;
    if (m.size() == 1) {
      Map.Entry<?, ?> e = m.entrySet().iterator().next();
      return parseEntry(key(e.getKey(), path), e.getValue(), path);
    }

    List<FilterNode> out = new ArrayList<>(m.size());
    for (Map.Entry<?, ?> e : m.entrySet()) {
      FilterNode n = parseEntry(key(e.getKey(), path), e.getValue(), path);
      if (n != null) out.add(n);
    }
    return new LogicalGroup(Clause.AND, out);
  }

  private static FilterNode parseEntry(String key, Object value, String path) {
    String at = path + "." + key;
    if (AND.equals(key)) return new LogicalGroup(Clause.AND, parseChildren(value, at));
    if (OR.equals(key)) return new LogicalGroup(Clause.OR, parseChildren(value, at));

    Operator op = Operator.fromKey(key);
    if (op != null) return parseCondition(op, value, at);

    FilterNode sub = parseSubfilter(value, at);
    return (sub == null) ? null : new FieldRef(key, sub);
  }

  private static FilterNode parseSubfilter(Object value, String at) {
    if (isList(value)) return parseCondition(Operator.IN, value, at);
    if (value instanceof Map<?, ?> m) return parseMap(m, at);
    if (isScalar(value)) return new Condition(Operator.EQ, value);
    throw new MalformedFilterException("Error parsing filter at '" + at + "'. Type " + typeName(value) + " is not supported");
  }

  private static Condition parseCondition(Operator op, Object value, String at) {
    if (op.isList()) {
      if (!isList(value)) throw new MalformedFilterException("'" + at + "' expects an array, got " + typeName(value));
      return new Condition(op, value);
    }
    if (op == Operator.CONTAINS) {
      if (!(value instanceof CharSequence cs)) {
        throw new MalformedFilterException("'" + at + "' expects a string, got " + typeName(value));
      }
      return new Condition(op, cs.toString());
    }
    if (value == null) {
      if (op == Operator.EQ || op == Operator.NE) return new Condition(op, null);
      throw new MalformedFilterException("'" + at + "' requires a non-null value");
    }
    if (!isScalar(value)) {
      throw new MalformedFilterException("'" + at + "' expects a scalar, got " + typeName(value));
    }
    return new Condition(op, value);
  }

  private static List<FilterNode> parseChildren(Object value, String at) {
    if (!isList(value)) throw new MalformedFilterException("'" + at + "' expects an array, got " + typeName(value));
    List<FilterNode> out = new ArrayList<>();
    int i = 0;
    for (Object child : asIterable(value)) {
      String childPath = at + "[" + (i++) + "]";
      if (child == null) continue;
      if (!(child instanceof Map<?, ?> m)) {
        throw new MalformedFilterException("'" + childPath + "' expects an object, got " + typeName(child));
      }
      FilterNode n = parseMap(m, childPath);
      if (n != null) out.add(n);
    }
    return out;
  }

  private static String key(Object k, String path) {
    if (!(k instanceof String s)) throw new MalformedFilterException("Non-string key under '" + path + "': " + k);
    return s;
  }

  static boolean isScalar(Object v) {
    return v instanceof CharSequence
        || v instanceof Number
        || v instanceof Boolean
        || v instanceof Character
        || v instanceof UUID
        || v instanceof Enum<?>
        || v instanceof TemporalAccessor
        || v instanceof Date;
  }

  private static boolean isList(Object v) {
    return v instanceof Collection<?> || (v != null && v.getClass().isArray());
  }

  private static Iterable<?> asIterable(Object v) {
    if (v instanceof Collection<?> c) return c;
    int n = Array.getLength(v);
    List<Object> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) out.add(Array.get(v, i));
    return out;
  }

  private static String typeName(Object v) {
    return (v == null) ? "null" : v.getClass().getSimpleName();
  }
}
