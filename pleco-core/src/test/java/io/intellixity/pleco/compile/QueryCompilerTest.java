package io.intellixity.pleco.compile;

import io.intellixity.pleco.query.LimitOffsetPage;
import io.intellixity.pleco.query.ListQuery;
import io.intellixity.pleco.query.SortField;
import io.intellixity.pleco.querybuilder.RecordingQueryBuilder;
import io.intellixity.pleco.querybuilder.SubqueryRegistry;
import org.junit.jupiter.api.Test;

import static io.intellixity.pleco.query.Filters.*;
import static org.junit.jupiter.api.Assertions.*;

final class QueryCompilerTest {
  @Test
  void appliesFilterThenSortThenPage() {
    ListQuery q = ListQuery.of(field("year", gte(2015)))
        .withSort(SortField.desc("year"))
        .withPage(LimitOffsetPage.of(2, 1));

    String out = new QueryCompiler().compile(q, SubqueryRegistry.<String>empty(), RecordingQueryBuilder.table("vehicles")).build();

    assertEquals("from(vehicles) where{where{where(year >= 2015)}} orderBy(year,DESC) offset(1) limit(2)", out);
  }

  @Test
  void absentQueryIsIdentity() {
    RecordingQueryBuilder base = RecordingQueryBuilder.table("vehicles");
    assertSame(base, new QueryCompiler().compile(null, SubqueryRegistry.empty(), base));
    assertSame(base, new QueryCompiler().compile(new ListQuery(), SubqueryRegistry.empty(), base));
    assertEquals("from(vehicles)", base.build());
  }
}
