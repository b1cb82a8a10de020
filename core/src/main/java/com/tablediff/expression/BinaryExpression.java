package com.tablediff.expression;

import com.tablediff.generator.SQLDialect;
import java.util.Objects;

/**
 * Expression representing a binary operation.
 *
 * <p>Only the operations a reconciliation query needs are modelled:
 * <pre>
 *   t1."t1_id" = t2."t2_id"                           -- key matching
 *   t1."t1_name" IS DISTINCT FROM t2."t2_name"        -- NULL-safe inequality
 *   a AND b, a OR b                                   -- predicate composition
 * </pre>
 *
 * <p>{@link Operator#IS_DISTINCT_FROM} treats two NULLs as equal and a NULL
 * and a non-NULL value as distinct, unlike {@code <>}, which yields unknown
 * whenever an operand is NULL. Its spelling comes from the dialect.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        EQUAL("="),
        IS_DISTINCT_FROM("IS DISTINCT FROM"),
        AND("AND"),
        OR("OR");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    @Override
    public String toSQL(SQLDialect dialect) {
        String leftSQL = left.toSQL(dialect);
        String rightSQL = right.toSQL(dialect);
        if (operator == Operator.IS_DISTINCT_FROM) {
            return "(" + dialect.nullSafeDistinct(leftSQL, rightSQL) + ")";
        }
        return String.format("(%s %s %s)", leftSQL, operator.symbol(), rightSQL);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(left, that.left) &&
               Objects.equals(right, that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    // ==================== Factory Methods ====================

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression isDistinctFrom(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.IS_DISTINCT_FROM, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }
}
