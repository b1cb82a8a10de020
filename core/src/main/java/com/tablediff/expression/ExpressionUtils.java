package com.tablediff.expression;

import java.util.List;

/**
 * Helpers for folding lists of predicates.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {} // Utility class

    /**
     * Combines predicates with AND, left to right.
     *
     * @param predicates at least one predicate
     * @return the conjunction
     * @throws IllegalArgumentException if the list is empty
     */
    public static Expression allOf(List<? extends Expression> predicates) {
        return fold(predicates, BinaryExpression.Operator.AND);
    }

    /**
     * Combines predicates with OR, left to right.
     *
     * @param predicates at least one predicate
     * @return the disjunction
     * @throws IllegalArgumentException if the list is empty
     */
    public static Expression anyOf(List<? extends Expression> predicates) {
        return fold(predicates, BinaryExpression.Operator.OR);
    }

    private static Expression fold(List<? extends Expression> predicates, BinaryExpression.Operator op) {
        if (predicates.isEmpty()) {
            throw new IllegalArgumentException("Cannot combine an empty list of predicates with " + op);
        }
        Expression result = predicates.get(0);
        for (int i = 1; i < predicates.size(); i++) {
            result = new BinaryExpression(result, op, predicates.get(i));
        }
        return result;
    }
}
