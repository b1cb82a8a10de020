package com.tablediff.expression;

import com.tablediff.generator.SQLDialect;
import java.util.Objects;

/**
 * Expression representing a NULL check.
 *
 * <p>Example:
 * <pre>
 *   (t2."t2_id" IS NULL)       -- row absent from table 2
 * </pre>
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        IS_NULL("IS NULL");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    @Override
    public String toSQL(SQLDialect dialect) {
        return String.format("(%s %s)", operand.toSQL(dialect), operator.symbol());
    }

    @Override
    public String toString() {
        return "(" + operand + " " + operator.symbol() + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }
}
