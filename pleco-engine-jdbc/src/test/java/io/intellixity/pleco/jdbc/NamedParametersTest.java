package io.intellixity.pleco.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NamedParametersTest {
  @Test
  void rewritesNamedParameters() {
    assertEquals("SELECT * FROM t WHERE a = ? AND b IN (?, ?)", NamedParameters.toJdbcSql("SELECT * FROM t WHERE a = :b1 AND b IN (:b2, :tenantId)"));
  }

  @Test
  void ignoresCastsAndQuotedText() {
    String sql = "SELECT x::text, ':b1', \"col:b2\" FROM t WHERE y = :b3 AND z = 'it''s :b4'";
    assertEquals("SELECT x::text, ':b1', \"col:b2\" FROM t WHERE y = ? AND z = 'it''s :b4'", NamedParameters.toJdbcSql(sql));
  }
}
