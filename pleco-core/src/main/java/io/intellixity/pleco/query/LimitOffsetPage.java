package io.intellixity.pleco.query;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Limit/offset page. Either bound may be absent: no offset means the configured default, no limit means
 * unbounded. Map input must hold integral values in {@code int} range; sign checks belong to input validation.
 */
public record LimitOffsetPage(Integer limit, Integer offset) {
  public static LimitOffsetPage of(int limit, int offset) { return new LimitOffsetPage(limit, offset); }
  public static LimitOffsetPage limit(int limit) { return new LimitOffsetPage(limit, null); }
  public static LimitOffsetPage offset(int offset) { return new LimitOffsetPage(null, offset); }

  public static LimitOffsetPage fromMap(Map<String, ?> page) {
    if (page == null) return null;
    return new LimitOffsetPage(intOrNull(page.get("limit"), "limit"), intOrNull(page.get("offset"), "offset"));
  }

  private static Integer intOrNull(Object v, String name) {
    if (v == null) return null;
    try {
      BigDecimal d = new BigDecimal(String.valueOf(v).trim());
      return d.intValueExact();
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("page." + name + " must be an integer, got: " + v, e);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("page." + name + " must be an integer in int range, got: " + v, e);
    }
  }
}
