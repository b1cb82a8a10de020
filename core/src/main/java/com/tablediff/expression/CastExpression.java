package com.tablediff.expression;

import com.tablediff.generator.SQLDialect;
import com.tablediff.types.ScalarType;
import java.util.Objects;

/**
 * Expression that casts another expression to one of the supported scalar types.
 *
 * <p>Examples (DuckDB / BigQuery):
 * <pre>
 *   CAST(t1."amount" AS DOUBLE)      CAST(t1.`amount` AS FLOAT64)
 *   CAST(t1."created" AS TIMESTAMP)  CAST(t1.`created` AS TIMESTAMP)
 * </pre>
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final ScalarType targetType;

    /**
     * Creates a cast expression.
     *
     * @param expression the expression to cast
     * @param targetType the target type
     */
    public CastExpression(Expression expression, ScalarType targetType) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public ScalarType targetType() {
        return targetType;
    }

    @Override
    public String toSQL(SQLDialect dialect) {
        return String.format("CAST(%s AS %s)", expression.toSQL(dialect), dialect.castTypeName(targetType));
    }

    @Override
    public String toString() {
        return "CAST(" + expression + " AS " + targetType + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return Objects.equals(expression, that.expression) &&
               targetType == that.targetType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType);
    }
}
