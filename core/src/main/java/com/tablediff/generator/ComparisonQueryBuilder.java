package com.tablediff.generator;

import com.tablediff.expression.AliasExpression;
import com.tablediff.expression.BinaryExpression;
import com.tablediff.expression.CastExpression;
import com.tablediff.expression.ColumnReference;
import com.tablediff.expression.Expression;
import com.tablediff.expression.ExpressionUtils;
import com.tablediff.expression.FunctionCall;
import com.tablediff.expression.UnaryExpression;
import com.tablediff.plan.ComparisonPlan;
import com.tablediff.schema.TableRef;
import com.tablediff.types.ScalarType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Generates the single reconciliation query for a {@link ComparisonPlan}.
 *
 * <p>The query full-outer-joins both tables on all primary key columns and
 * keeps a row when it is missing from one side or when any comparison column
 * is NULL-safely distinct between the sides. Casts are applied to both sides
 * in a prepared CTE, so the predicate and the returned values are post-cast.
 * A column declared with different types in the two tables and no explicit
 * cast is cast to the dialect's text type on both sides.
 *
 * <p>Generated shape (DuckDB, key {@code id}, one column {@code amt}):
 * <pre>
 * WITH table1_prepared AS (
 *     SELECT t1."id" AS "t1_id", t1."amt" AS "t1_amt" FROM "a" t1
 * ),
 * table2_prepared AS (
 *     SELECT t2."id" AS "t2_id", t2."amt" AS "t2_amt" FROM "b" t2
 * )
 * SELECT COALESCE(t1."t1_id", t2."t2_id") AS "id", t1."t1_id", t1."t1_amt", t2."t2_id", t2."t2_amt"
 * FROM table1_prepared t1
 * FULL OUTER JOIN table2_prepared t2 ON (t1."t1_id" = t2."t2_id")
 * WHERE (((t1."t1_amt" IS DISTINCT FROM t2."t2_amt") OR (t2."t2_id" IS NULL)) OR (t1."t1_id" IS NULL))
 * ORDER BY "id"
 * LIMIT 20
 * </pre>
 *
 * <p>The LIMIT is applied after the predicate: it bounds the reported
 * differences, not the join. A presence-only plan drops the value predicate
 * and only keeps the two absence conditions.
 *
 * @see SQLDialect
 */
public class ComparisonQueryBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonQueryBuilder.class);

    private static final String INDENT = "    ";

    private final SQLDialect dialect;

    /**
     * Creates a builder for the given dialect.
     *
     * @param dialect the target dialect
     */
    public ComparisonQueryBuilder(SQLDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public SQLDialect dialect() {
        return dialect;
    }

    /**
     * Builds the reconciliation query without a limit.
     *
     * @param table1 the first table
     * @param table2 the second table
     * @param plan the comparison plan
     * @return the SQL text
     */
    public String build(TableRef table1, TableRef table2, ComparisonPlan plan) {
        return build(table1, table2, plan, OptionalInt.empty());
    }

    /**
     * Builds the reconciliation query.
     *
     * @param table1 the first table
     * @param table2 the second table
     * @param plan the comparison plan
     * @param limit the maximum number of rows to return, if any
     * @return the SQL text
     * @throws IllegalArgumentException if the limit is negative
     */
    public String build(TableRef table1, TableRef table2, ComparisonPlan plan, OptionalInt limit) {
        Objects.requireNonNull(table1, "table1 must not be null");
        Objects.requireNonNull(table2, "table2 must not be null");
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(limit, "limit must not be null");
        if (limit.isPresent() && limit.getAsInt() < 0) {
            throw new IllegalArgumentException("limit must be non-negative: " + limit.getAsInt());
        }

        List<String> selected = selectedColumns(plan);

        StringBuilder sql = new StringBuilder();
        sql.append("WITH ");
        appendPreparedTable(sql, TableSide.TABLE1, table1, selected, plan);
        sql.append(",\n");
        appendPreparedTable(sql, TableSide.TABLE2, table2, selected, plan);
        sql.append("\n");

        sql.append("SELECT\n").append(INDENT).append(outputColumns(plan, selected)).append("\n");
        sql.append("FROM ").append(TableSide.TABLE1.cteName()).append(' ').append(TableSide.TABLE1.alias()).append("\n");
        sql.append(dialect.fullOuterJoin()).append(' ')
           .append(TableSide.TABLE2.cteName()).append(' ').append(TableSide.TABLE2.alias())
           .append(" ON ").append(joinCondition(plan).toSQL(dialect)).append("\n");
        sql.append("WHERE ").append(interestingRowPredicate(plan).toSQL(dialect)).append("\n");
        sql.append("ORDER BY ").append(plan.primaryKey().stream()
            .map(dialect::quoteIdentifier)
            .collect(Collectors.joining(", ")));

        if (limit.isPresent()) {
            sql.append("\n").append(dialect.limitClause(limit.getAsInt()));
        }

        String result = sql.toString();
        logger.debug("Generated {} reconciliation query for {} vs {}:\n{}", dialect.name(), table1, table2, result);
        return result;
    }

    /**
     * Primary key columns followed by comparison columns.
     */
    private static List<String> selectedColumns(ComparisonPlan plan) {
        List<String> columns = new ArrayList<>(plan.primaryKey());
        columns.addAll(plan.comparisonColumns());
        return columns;
    }

    private void appendPreparedTable(StringBuilder sql, TableSide side, TableRef table,
                                     List<String> columns, ComparisonPlan plan) {
        List<String> projections = new ArrayList<>();
        for (String column : columns) {
            Expression value = ColumnReference.qualified(side.alias(), column);
            Optional<ScalarType> cast = plan.effectiveCast(column);
            if (cast.isPresent()) {
                value = new CastExpression(value, cast.get());
            }
            projections.add(new AliasExpression(value, side.columnAlias(column)).toSQL(dialect));
        }

        sql.append(side.cteName()).append(" AS (\n")
           .append(INDENT).append("SELECT ").append(String.join(", ", projections))
           .append(" FROM ").append(dialect.quoteTableName(table)).append(' ').append(side.alias())
           .append("\n)");
    }

    private String outputColumns(ComparisonPlan plan, List<String> selected) {
        List<String> outputs = new ArrayList<>();
        for (String key : plan.primaryKey()) {
            Expression coalesced = FunctionCall.coalesce(sideColumn(TableSide.TABLE1, key), sideColumn(TableSide.TABLE2, key));
            outputs.add(new AliasExpression(coalesced, key).toSQL(dialect));
        }
        for (TableSide side : TableSide.values()) {
            for (String column : selected) {
                outputs.add(sideColumn(side, column).toSQL(dialect));
            }
        }
        return String.join(",\n" + INDENT, outputs);
    }

    private Expression joinCondition(ComparisonPlan plan) {
        List<Expression> equalities = new ArrayList<>();
        for (String key : plan.primaryKey()) {
            equalities.add(BinaryExpression.equal(sideColumn(TableSide.TABLE1, key), sideColumn(TableSide.TABLE2, key)));
        }
        return ExpressionUtils.allOf(equalities);
    }

    /**
     * Value differences OR only in table 1 OR only in table 2.
     */
    Expression interestingRowPredicate(ComparisonPlan plan) {
        List<Expression> conditions = new ArrayList<>();

        if (!plan.presenceOnly()) {
            List<Expression> distinct = new ArrayList<>();
            for (String column : plan.comparisonColumns()) {
                distinct.add(BinaryExpression.isDistinctFrom(
                    sideColumn(TableSide.TABLE1, column), sideColumn(TableSide.TABLE2, column)));
            }
            conditions.add(ExpressionUtils.anyOf(distinct));
        }

        conditions.add(absentFrom(TableSide.TABLE2, plan));
        conditions.add(absentFrom(TableSide.TABLE1, plan));
        return ExpressionUtils.anyOf(conditions);
    }

    private Expression absentFrom(TableSide side, ComparisonPlan plan) {
        List<Expression> nullKeys = new ArrayList<>();
        for (String key : plan.primaryKey()) {
            nullKeys.add(UnaryExpression.isNull(sideColumn(side, key)));
        }
        return ExpressionUtils.allOf(nullKeys);
    }

    private static ColumnReference sideColumn(TableSide side, String column) {
        return ColumnReference.qualified(side.alias(), side.columnAlias(column));
    }
}
