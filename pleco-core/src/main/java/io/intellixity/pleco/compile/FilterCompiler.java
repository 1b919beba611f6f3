package io.intellixity.pleco.compile;

import io.intellixity.pleco.query.*;
import io.intellixity.pleco.querybuilder.QueryBuilder;
import io.intellixity.pleco.querybuilder.SubqueryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Lowers a filter tree into predicate calls on a {@link QueryBuilder}.
 * <p>
 * AND children are added with {@code where(callback)}, OR children with {@code orWhere(callback)}, so every
 * child becomes its own parenthesized group. A field with a registered subquery is matched through
 * {@code id IN (SELECT resource_id FROM <subquery> AS <alias> WHERE <subfilter on value>)}; any other field
 * is filtered as a column of the query itself (or rejected, see {@link UnknownFieldPolicy}).
 * <p>
 * The whole filter is added as one group, so a top-level OR never disjoins with predicates already present
 * on the base query.
 */
public final class FilterCompiler {
  private static final Logger log = LoggerFactory.getLogger(FilterCompiler.class);

  private final CompilerOptions options;

  public FilterCompiler() {
    this(CompilerOptions.DEFAULT);
  }

  public FilterCompiler(CompilerOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  /** Compile JSON-shaped filter input; see {@link FilterParser}. */
  public <T> QueryBuilder<T> compile(Map<String, ?> filter, SubqueryRegistry<T> subqueries, QueryBuilder<T> query) {
    return compile(FilterParser.parse(filter), subqueries, query);
  }

  public <T> QueryBuilder<T> compile(FilterNode filter, SubqueryRegistry<T> subqueries, QueryBuilder<T> query) {
    return compile(filter, subqueries, SubqueryRegistry.VALUE, query);
  }

  /**
   * @param valueColumn column terminal operators apply to when the filter is not wrapped in a field
   */
  public <T> QueryBuilder<T> compile(FilterNode filter, SubqueryRegistry<T> subqueries, String valueColumn,
                                     QueryBuilder<T> query) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(valueColumn, "valueColumn");
    if (filter == null) return query;

    SubqueryRegistry<T> registry = (subqueries == null) ? SubqueryRegistry.empty() : subqueries;
    CompileContext ctx = new CompileContext();
    query.where(b -> new Lowering<>(options, registry, ctx, valueColumn, b).lower(filter));

    if (log.isDebugEnabled()) {
      log.debug("pleco.filter compiled filter={} correlatedSubqueries={}", filter, ctx.aliasCount());
    }
    return query;
  }

  private static final class Lowering<T> implements FilterVisitor<QueryBuilder<T>> {
    private final CompilerOptions options;
    private final SubqueryRegistry<T> subqueries;
    private final CompileContext ctx;
    private final String valueColumn;
    private final QueryBuilder<T> query;

    Lowering(CompilerOptions options, SubqueryRegistry<T> subqueries, CompileContext ctx,
             String valueColumn, QueryBuilder<T> query) {
      this.options = options;
      this.subqueries = subqueries;
      this.ctx = ctx;
      this.valueColumn = valueColumn;
      this.query = query;
    }

    QueryBuilder<T> lower(FilterNode node) {
      return node.accept(this);
    }

    private QueryBuilder<T> lowerInto(QueryBuilder<T> nested, String column, FilterNode node) {
      return new Lowering<>(options, subqueries, ctx, column, nested).lower(node);
    }

    @Override
    public QueryBuilder<T> visit(LogicalGroup group) {
      for (FilterNode child : group.elements()) {
        switch (group.clause()) {
          case AND -> query.where(b -> lowerInto(b, valueColumn, child));
          case OR -> query.orWhere(b -> lowerInto(b, valueColumn, child));
        }
      }
      return query;
    }

    @Override
    public QueryBuilder<T> visit(FieldRef ref) {
      String field = ref.field();
      QueryBuilder<T> subquery = subqueries.lookup(field);

      if (subquery == null) {
        if (options.unknownFieldPolicy() == UnknownFieldPolicy.REJECT) {
          throw new MissingSubqueryException(field, "filter");
        }
        return query.where(b -> lowerInto(b, field, ref.subfilter()));
      }

      String alias = ctx.nextAlias(field);
      QueryBuilder<T> ids = query.getNewInstance()
          .select(SubqueryRegistry.RESOURCE_ID)
          .from(subquery.clone().as(alias))
          .where(b -> lowerInto(b, SubqueryRegistry.VALUE, ref.subfilter()));
      return query.whereIn(options.resourceIdColumn(), ids);
    }

    @Override
    public QueryBuilder<T> visit(Condition c) {
      String col = valueColumn;
      Object v = c.value();
      return switch (c.operator()) {
        case IN -> query.whereIn(col, c.values());
        case NIN -> query.whereNotIn(col, c.values());
        case EQ -> (v == null) ? query.whereNull(col) : query.where(col, "=", v);
        case NE -> (v == null) ? query.whereNotNull(col) : query.where(col, "<>", v);
        case GT -> query.where(col, ">", requireValue(c));
        case LT -> query.where(col, "<", requireValue(c));
        case GTE -> query.where(col, ">=", requireValue(c));
        case LTE -> query.where(col, "<=", requireValue(c));
        case CONTAINS -> query.whereRaw("lower(??) LIKE ?",
            List.of(col, "%" + String.valueOf(requireValue(c)).toLowerCase(Locale.ROOT) + "%"));
      };
    }

    private static Object requireValue(Condition c) {
      if (c.value() == null) throw new MalformedFilterException(c.operator().key() + " requires a non-null value");
      return c.value();
    }
  }
}
