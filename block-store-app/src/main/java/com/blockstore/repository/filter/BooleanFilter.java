package com.blockstore.repository.filter;

import com.blockstore.exception.FilterValidationException;

import java.util.List;

/** AND / OR over two or more expressions, or NOT over exactly one. */
public record BooleanFilter(LogicalOperator operator, List<FilterExpression> operands) implements FilterExpression {

    public BooleanFilter {
        if (operator == null) {
            throw new FilterValidationException("BooleanFilter requires an operator.");
        }
        if (operands == null || operands.isEmpty()) {
            throw new FilterValidationException("BooleanFilter requires at least one operand.");
        }
        if (operands.contains(null)) {
            throw new FilterValidationException("BooleanFilter operands cannot be null.");
        }
        if (operator != LogicalOperator.NOT && operands.size() < 2) {
            throw new FilterValidationException(operator + " requires two or more operands.");
        }
        if (operator == LogicalOperator.NOT && operands.size() != 1) {
            throw new FilterValidationException("NOT requires exactly one operand.");
        }
        operands = List.copyOf(operands);
    }

    public static BooleanFilter and(FilterExpression... operands) {
        return new BooleanFilter(LogicalOperator.AND, List.of(operands));
    }

    public static BooleanFilter or(FilterExpression... operands) {
        return new BooleanFilter(LogicalOperator.OR, List.of(operands));
    }

    public static BooleanFilter not(FilterExpression operand) {
        return new BooleanFilter(LogicalOperator.NOT, List.of(operand));
    }
}
