package io.intellixity.pleco.schema;

import io.intellixity.pleco.query.FilterParser;
import io.intellixity.pleco.query.Operator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Validates JSON-shaped list-query input against the filterable fields of one resource.
 * <p>
 * Filter rules:
 * <ul>
 *   <li>top-level keys are {@code AND}, {@code OR} or known fields</li>
 *   <li>a field accepts a literal of its type, an array of literals, or an object whose keys are
 *       {@code AND}, {@code OR} or operators allowed for its type ({@link ScalarType#operators()})</li>
 *   <li>{@code eq}/{@code ne} accept {@code null}; {@code in}/{@code nin} take arrays</li>
 * </ul>
 * Sort is a single {@code {field: "asc"|"desc"}} entry (case-insensitive); page bounds are non-negative
 * integers.
 * <p>
 * With {@link Builder#singleOperator(boolean)} a field's object node may carry only one key, so
 * {@code {gte: 1, lt: 5}} must be written as {@code {AND: [{gte: 1}, {lt: 5}]}}.
 */
public final class FilterSchema {
  private static final Logger log = LoggerFactory.getLogger(FilterSchema.class);

  private final Map<String, ScalarType> fields;
  private final boolean singleOperator;

  private FilterSchema(Map<String, ScalarType> fields, boolean singleOperator) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    this.singleOperator = singleOperator;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FilterSchema of(Map<String, ScalarType> fields) {
    Builder b = builder();
    fields.forEach(b::field);
    return b.build();
  }

  public Map<String, ScalarType> fields() { return fields; }
  public boolean singleOperator() { return singleOperator; }

  /** Validate a request body with optional {@code filter}, {@code sort} and {@code page} members. */
  public void validate(Map<String, ?> request) {
    if (request == null) return;
    for (String key : request.keySet()) {
      if (!"filter".equals(key) && !"sort".equals(key) && !"page".equals(key)) {
        throw reject(key, "Unknown request member");
      }
    }
    validateFilter(request.get("filter"));
    validateSort(request.get("sort"));
    validatePage(request.get("page"));
  }

  public void validateFilter(Object filter) {
    if (filter == null) return;
    validateNode(filter, "filter");
  }

  public void validateSort(Object sort) {
    if (sort == null) return;
    if (!(sort instanceof Map<?, ?> m)) throw reject("sort", "Expected an object");
    if (m.size() > 1) throw reject("sort", "Only one sort field is supported");
    for (Map.Entry<?, ?> e : m.entrySet()) {
      String path = "sort." + e.getKey();
      if (!fields.containsKey(String.valueOf(e.getKey()))) throw reject(path, "Unknown field");
      Object dir = e.getValue();
      if (!(dir instanceof CharSequence cs)) throw reject(path, "Expected 'asc' or 'desc'");
      String d = cs.toString().trim();
      if (!d.equalsIgnoreCase("asc") && !d.equalsIgnoreCase("desc")) throw reject(path, "Expected 'asc' or 'desc'");
    }
  }

  public void validatePage(Object page) {
    if (page == null) return;
    if (!(page instanceof Map<?, ?> m)) throw reject("page", "Expected an object");
    for (Map.Entry<?, ?> e : m.entrySet()) {
      String key = String.valueOf(e.getKey());
      String path = "page." + key;
      if (!"limit".equals(key) && !"offset".equals(key)) throw reject(path, "Unknown page member");
      Object v = e.getValue();
      if (v == null) continue;
      if (!ScalarType.INT.accepts(v)) throw reject(path, "Expected an integer");
      if (((Number) v).doubleValue() < 0) throw reject(path, "Must be >= 0");
      if (((Number) v).doubleValue() > Integer.MAX_VALUE) throw reject(path, "Too large");
    }
  }

  private void validateNode(Object node, String path) {
    if (!(node instanceof Map<?, ?> m)) throw reject(path, "Expected an object");

    for (Map.Entry<?, ?> e : m.entrySet()) {
      String key = String.valueOf(e.getKey());
      String at = path + "." + key;
      if (FilterParser.AND.equals(key) || FilterParser.OR.equals(key)) {
        forEachChild(e.getValue(), at, this::validateNode);
        continue;
      }
      ScalarType type = fields.get(key);
      if (type == null) throw reject(at, "Unknown field");
      validateFieldExpression(type, e.getValue(), at);
    }
  }

  private void validateFieldExpression(ScalarType type, Object v, String path) {
    if (v == null) throw reject(path, "Expected a value, an array or an object");
    if (isList(v)) {
      validateLiterals(type, v, path);
      return;
    }
    if (!(v instanceof Map<?, ?> m)) {
      if (!type.accepts(v)) throw reject(path, "Expected " + type.graphQLName());
      return;
    }

    if (singleOperator && m.size() > 1) throw reject(path, "Only one operator is allowed per object");
    for (Map.Entry<?, ?> e : m.entrySet()) {
      String key = String.valueOf(e.getKey());
      String at = path + "." + key;
      if (FilterParser.AND.equals(key) || FilterParser.OR.equals(key)) {
        forEachChild(e.getValue(), at, (child, childPath) -> {
          if (!(child instanceof Map<?, ?>)) throw reject(childPath, "Expected an object");
          validateFieldExpression(type, child, childPath);
        });
        continue;
      }

      Operator op = Operator.fromKey(key);
      if (op == null) throw reject(at, "Unknown operator");
      if (!type.allows(op)) throw reject(at, "Operator not allowed for " + type.graphQLName());

      Object value = e.getValue();
      if (op.isList()) {
        if (!isList(value)) throw reject(at, "Expected an array");
        validateLiterals(type, value, at);
      } else if (value == null) {
        if (op != Operator.EQ && op != Operator.NE) throw reject(at, "Must not be null");
      } else if (!type.accepts(value)) {
        throw reject(at, "Expected " + type.graphQLName());
      }
    }
  }

  private void validateLiterals(ScalarType type, Object list, String path) {
    int i = 0;
    for (Object item : asList(list)) {
      if (!type.accepts(item)) throw reject(path + "[" + i + "]", "Expected " + type.graphQLName());
      i++;
    }
  }

  private interface ChildValidator {
    void validate(Object child, String path);
  }

  private void forEachChild(Object v, String path, ChildValidator validator) {
    if (!isList(v)) throw reject(path, "Expected an array");
    int i = 0;
    for (Object child : asList(v)) {
      String childPath = path + "[" + (i++) + "]";
      if (child == null) continue;
      validator.validate(child, childPath);
    }
  }

  private static boolean isList(Object v) {
    return v instanceof Collection<?> || (v != null && v.getClass().isArray());
  }

  private static List<Object> asList(Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    int n = java.lang.reflect.Array.getLength(v);
    List<Object> out = new ArrayList<>(n);
    for (int i = 0; i < n; i++) out.add(java.lang.reflect.Array.get(v, i));
    return out;
  }

  private static FilterValidationException reject(String path, String reason) {
    log.debug("pleco.schema rejected path={} reason={}", path, reason);
    return new FilterValidationException(path, reason);
  }

  public static final class Builder {
    private final Map<String, ScalarType> fields = new LinkedHashMap<>();
    private boolean singleOperator;

    private Builder() {}

    public Builder field(String name, ScalarType type) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(type, "type");
      if (FilterParser.AND.equals(name) || FilterParser.OR.equals(name) || Operator.fromKey(name) != null) {
        throw new IllegalArgumentException("Reserved filter key cannot be a field name: " + name);
      }
      fields.put(name, type);
      return this;
    }

    public Builder singleOperator(boolean singleOperator) {
      this.singleOperator = singleOperator;
      return this;
    }

    public FilterSchema build() {
      return new FilterSchema(fields, singleOperator);
    }
  }
}
