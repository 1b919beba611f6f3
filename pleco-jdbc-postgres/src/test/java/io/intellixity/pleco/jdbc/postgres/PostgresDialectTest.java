package io.intellixity.pleco.jdbc.postgres;

import io.intellixity.pleco.compile.QueryCompiler;
import io.intellixity.pleco.jdbc.ColumnSubqueries;
import io.intellixity.pleco.jdbc.SqlQueryBuilder;
import io.intellixity.pleco.jdbc.SqlStatement;
import io.intellixity.pleco.query.LimitOffsetPage;
import io.intellixity.pleco.query.ListQuery;
import io.intellixity.pleco.query.SortField;
import io.intellixity.pleco.querybuilder.SubqueryRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.pleco.query.Filters.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  @Test
  void quotesDottedAndAliasedReferences() {
    assertEquals("\"m\".\"name\" AS \"value\"", d.quoteRef("m.name as value"));
    assertEquals("\"subquery\".*", d.quoteRef("subquery.*"));
    assertEquals("\"we\"\"ird\"", d.quoteRef("we\"ird"));
  }

  @Test
  void rendersLimitOffsetPaging() {
    SqlStatement ss = SqlQueryBuilder.table(d, "vehicles").offset(20).limit(10).build();
    assertEquals("SELECT * FROM \"vehicles\" LIMIT 10 OFFSET 20", ss.sql());
    assertEquals("SELECT * FROM \"vehicles\" OFFSET 0", SqlQueryBuilder.table(d, "vehicles").offset(0).build().sql());
  }

  @Test
  void compilesListQueryWithColumnSubqueries() {
    SubqueryRegistry<SqlStatement> subqueries = ColumnSubqueries.forColumns(d, "vehicles", "id", List.of("year"));
    ListQuery q = ListQuery.of(field("year", gte(2015)))
        .withSort(SortField.desc("model"))
        .withPage(LimitOffsetPage.of(5, 0));

    SqlStatement ss = new QueryCompiler().compile(q, subqueries, SqlQueryBuilder.table(d, "vehicles")).build();

    assertEquals("SELECT * FROM \"vehicles\" WHERE (\"id\" IN (SELECT \"resource_id\" FROM "
        + "(SELECT \"id\" AS \"resource_id\", \"year\" AS \"value\", \"year\" AS \"sort\" FROM \"vehicles\") "
        + "AS \"subquery_year__1\" WHERE (\"value\" >= :b1))) ORDER BY \"model\" DESC LIMIT 5 OFFSET 0", ss.sql());
    assertEquals(List.of(2015), ss.binds());
  }

  @Test
  void keepsPostgresCastsWhenRewritingPlaceholders() {
    SqlStatement ss = SqlQueryBuilder.table(d, "vehicles")
        .whereRaw("created_at::date = ?", List.of("2024-01-01"))
        .build();
    assertEquals("SELECT * FROM \"vehicles\" WHERE created_at::date = ?", ss.jdbcSql());
    assertEquals(List.of("2024-01-01"), ss.binds());
  }
}
