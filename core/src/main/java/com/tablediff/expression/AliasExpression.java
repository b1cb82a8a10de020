package com.tablediff.expression;

import com.tablediff.generator.SQLDialect;
import java.util.Objects;

/**
 * Expression that gives an output name to another expression in a SELECT list.
 *
 * <p>Examples:
 * <pre>
 *   CAST(t1."amount" AS DOUBLE) AS "t1_amount"
 *   COALESCE(t1."t1_id", t2."t2_id") AS "id"
 * </pre>
 */
public final class AliasExpression implements Expression {

    private final Expression expression;
    private final String alias;

    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
    }

    @Override
    public String toSQL(SQLDialect dialect) {
        return expression.toSQL(dialect) + " AS " + dialect.quoteIdentifier(alias);
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return Objects.equals(expression, that.expression) &&
               Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }
}
