package io.intellixity.pleco.examples.service;

import io.intellixity.pleco.compile.QueryCompiler;
import io.intellixity.pleco.jdbc.ColumnSubqueries;
import io.intellixity.pleco.jdbc.JdbcQueryExecutor;
import io.intellixity.pleco.jdbc.SqlQueryBuilder;
import io.intellixity.pleco.jdbc.SqlStatement;
import io.intellixity.pleco.jdbc.dialect.SqlDialect;
import io.intellixity.pleco.query.ListQuery;
import io.intellixity.pleco.querybuilder.SubqueryRegistry;
import io.intellixity.pleco.schema.FilterSchema;
import io.intellixity.pleco.schema.ScalarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * List queries over {@code vehicles}. Each API field resolves through a subquery; {@code make} joins
 * {@code manufacturers} so callers filter and sort by manufacturer name.
 */
public final class VehicleSearchService {
  private static final Logger log = LoggerFactory.getLogger(VehicleSearchService.class);

  static final String TABLE = "vehicles";

  private final SqlDialect dialect;
  private final QueryCompiler compiler;
  private final JdbcQueryExecutor executor;
  private final FilterSchema schema;
  private final SubqueryRegistry<SqlStatement> subqueries;

  public VehicleSearchService(SqlDialect dialect, QueryCompiler compiler, JdbcQueryExecutor executor, FilterSchema schema) {
    this.dialect = dialect;
    this.compiler = compiler;
    this.executor = executor;
    this.schema = schema;
    this.subqueries = subqueries(dialect, compiler.options().resourceIdColumn());
  }

  public static FilterSchema schema(boolean singleOperator) {
    return FilterSchema.builder()
        .field("id", ScalarType.ID)
        .field("make", ScalarType.STRING)
        .field("model", ScalarType.STRING)
        .field("year", ScalarType.INT)
        .field("zeroToSixty", ScalarType.FLOAT)
        .singleOperator(singleOperator)
        .build();
  }

  static SubqueryRegistry<SqlStatement> subqueries(SqlDialect dialect, String idColumn) {
    SqlQueryBuilder make = SqlQueryBuilder.of(dialect)
        .select("v." + idColumn + " as " + SubqueryRegistry.RESOURCE_ID,
            "m.name as " + SubqueryRegistry.VALUE,
            "m.name as " + SubqueryRegistry.SORT)
        .from(TABLE + " as v")
        .leftJoin("manufacturers as m", "m.id", "v.make_id");
    return ColumnSubqueries.forColumns(dialect, TABLE, idColumn, List.of(idColumn, "model", "year", "zero_to_sixty"))
        .with("make", make);
  }

  public List<Map<String, Object>> search(Map<String, ?> request) {
    SqlStatement ss = compile(request, true);
    List<Map<String, Object>> rows = executor.query(ss);
    log.debug("pleco.vehicles search rows={}", rows.size());
    return rows;
  }

  /** Rows matching the filter of {@code request}; sort and page are validated but not applied. */
  public long count(Map<String, ?> request) {
    return executor.count(compile(request, false));
  }

  SqlStatement compile(Map<String, ?> request, boolean paged) {
    schema.validate(request);
    ListQuery q = ListQuery.fromMap(request);
    SqlQueryBuilder base = SqlQueryBuilder.table(dialect, TABLE);
    if (!paged) {
      return compiler.filters().compile(q.filter(), subqueries, base).build();
    }
    return compiler.compile(q, subqueries, base).build();
  }
}
