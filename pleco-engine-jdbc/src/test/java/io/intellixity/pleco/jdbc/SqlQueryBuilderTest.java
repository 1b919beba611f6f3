package io.intellixity.pleco.jdbc;

import io.intellixity.pleco.jdbc.dialect.AnsiSqlDialect;
import io.intellixity.pleco.query.SortDirection;
import io.intellixity.pleco.querybuilder.QueryConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SqlQueryBuilderTest {
  private final AnsiSqlDialect d = new AnsiSqlDialect();

  @Test
  void requiresDialectOrSeed() {
    assertThrows(QueryConfigurationException.class, () -> new SqlQueryBuilder(null, null));
    SqlQueryBuilder seed = SqlQueryBuilder.table(d, "vehicles");
    assertEquals("SELECT * FROM \"vehicles\"", new SqlQueryBuilder(null, seed).build().sql());
  }

  @Test
  void rendersSelectJoinWhereOrderAndPage() {
    SqlStatement ss = SqlQueryBuilder.of(d)
        .select("v.id", "m.name as make")
        .from("vehicles as v")
        .leftJoin("manufacturers as m", "m.id", "v.make_id")
        .where("v.year", ">=", 2015)
        .orderBy("v.year", SortDirection.DESC)
        .offset(10)
        .limit(5)
        .build();

    assertEquals("SELECT \"v\".\"id\", \"m\".\"name\" AS \"make\" FROM \"vehicles\" AS \"v\" "
        + "LEFT JOIN \"manufacturers\" AS \"m\" ON \"m\".\"id\" = \"v\".\"make_id\" "
        + "WHERE \"v\".\"year\" >= :b1 ORDER BY \"v\".\"year\" DESC OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY", ss.sql());
    assertEquals(List.of(2015), ss.binds());
    assertEquals("SELECT \"v\".\"id\", \"m\".\"name\" AS \"make\" FROM \"vehicles\" AS \"v\" "
        + "LEFT JOIN \"manufacturers\" AS \"m\" ON \"m\".\"id\" = \"v\".\"make_id\" "
        + "WHERE \"v\".\"year\" >= ? ORDER BY \"v\".\"year\" DESC OFFSET 10 ROWS FETCH NEXT 5 ROWS ONLY", ss.jdbcSql());
  }

  @Test
  void nullComparisonsBecomeNullChecks() {
    SqlStatement ss = SqlQueryBuilder.table(d, "vehicles")
        .where("year", "=", null)
        .where("model", "!=", null)
        .build();
    assertEquals("SELECT * FROM \"vehicles\" WHERE \"year\" IS NULL AND \"model\" IS NOT NULL", ss.sql());
    assertTrue(ss.binds().isEmpty());

    assertThrows(IllegalArgumentException.class, () -> SqlQueryBuilder.table(d, "vehicles").where("year", ">", null));
    assertThrows(IllegalArgumentException.class, () -> SqlQueryBuilder.table(d, "vehicles").where("year", "~", 1));
  }

  @Test
  void emptyInListsAreConstant() {
    SqlStatement ss = SqlQueryBuilder.table(d, "vehicles")
        .whereIn("year", List.of())
        .orWhere(b -> b.whereNotIn("year", List.of()))
        .build();
    assertEquals("SELECT * FROM \"vehicles\" WHERE 1 = 0 OR (1 = 1)", ss.sql());
  }

  @Test
  void nestedGroupsKeepBindOrder() {
    SqlStatement ss = SqlQueryBuilder.table(d, "vehicles")
        .where("make", "=", "Nissan")
        .where(b -> b.orWhere(x -> x.where("model", "=", "Sentra")).orWhere(x -> x.whereIn("year", Arrays.asList(2015, null))))
        .build();
    assertEquals("SELECT * FROM \"vehicles\" WHERE \"make\" = :b1 AND "
        + "((\"model\" = :b2) OR (\"year\" IN (:b3, :b4)))", ss.sql());
    assertEquals(Arrays.asList("Nissan", "Sentra", 2015, null), ss.binds());
  }

  @Test
  void groupsWithoutPredicatesAreSkipped() {
    SqlStatement ss = SqlQueryBuilder.table(d, "vehicles").where(b -> b).where(b -> b.where(x -> x)).build();
    assertEquals("SELECT * FROM \"vehicles\"", ss.sql());
  }

  @Test
  void rawFragmentsQuoteIdentifiersAndBindValues() {
    SqlStatement ss = SqlQueryBuilder.of(d)
        .selectRaw("(case when ?? = 'Who?' then ? else 1 end) as ??", List.of("m.name", 0, "sort"))
        .from("manufacturers as m")
        .whereRaw("lower(??) LIKE ?", List.of("m.name", "%tes%"))
        .build();
    assertEquals("SELECT (case when \"m\".\"name\" = 'Who?' then :b1 else 1 end) as \"sort\" "
        + "FROM \"manufacturers\" AS \"m\" WHERE lower(\"m\".\"name\") LIKE :b2", ss.sql());
    assertEquals(List.of(0, "%tes%"), ss.binds());

    assertThrows(QueryConfigurationException.class,
        () -> SqlQueryBuilder.table(d, "vehicles").whereRaw("a = ? and b = ?", List.of(1)).build());
    assertThrows(QueryConfigurationException.class,
        () -> SqlQueryBuilder.table(d, "vehicles").whereRaw("a = ?", List.of(1, 2)).build());
  }

  @Test
  void rawFragmentsLeaveQuestionMarksInQuotedIdentifiersAlone() {
    SqlStatement ss = SqlQueryBuilder.table(d, "survey")
        .whereRaw("\"is it?\" = ? and note <> 'why?' and \"a\"\"?\" = ?", List.of(true, 3))
        .build();
    assertEquals("SELECT * FROM \"survey\" WHERE \"is it?\" = :b1 and note <> 'why?' and \"a\"\"?\" = :b2", ss.sql());
    assertEquals(List.of(true, 3), ss.binds());
  }

  @Test
  void embeddedSubqueriesAreSnapshots() {
    SqlQueryBuilder sub = SqlQueryBuilder.table(d, "vehicles").select("id");
    SqlQueryBuilder outer = SqlQueryBuilder.table(d, "manufacturers").whereIn("id", sub);

    sub.where("year", "=", 2015);

    assertEquals("SELECT * FROM \"manufacturers\" WHERE \"id\" IN (SELECT \"id\" FROM \"vehicles\")", outer.build().sql());
  }

  @Test
  void cloneIsIndependent() {
    SqlQueryBuilder base = SqlQueryBuilder.table(d, "vehicles").where("year", ">", 2014);
    SqlQueryBuilder copy = base.clone();
    copy.where("model", "=", "Civic").as("c");

    assertEquals("SELECT * FROM \"vehicles\" WHERE \"year\" > :b1", base.build().sql());
    assertNull(base.alias());
    assertEquals("SELECT * FROM \"vehicles\" WHERE \"year\" > :b1 AND \"model\" = :b2", copy.build().sql());
  }

  @Test
  void subquerySourceNeedsAlias() {
    SqlQueryBuilder sub = SqlQueryBuilder.table(d, "vehicles");
    assertThrows(QueryConfigurationException.class, () -> SqlQueryBuilder.of(d).from(sub).build());

    SqlStatement ss = SqlQueryBuilder.of(d).select("s.*").from(sub.as("s")).build();
    assertEquals("SELECT \"s\".* FROM (SELECT * FROM \"vehicles\") AS \"s\"", ss.sql());
  }

  @Test
  void ansiPagingWithOnlyLimit() {
    assertEquals("SELECT * FROM \"vehicles\" FETCH FIRST 3 ROWS ONLY", SqlQueryBuilder.table(d, "vehicles").limit(3).build().sql());
  }
}
