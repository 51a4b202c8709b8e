package com.blockstore.repository.filter;

import com.blockstore.exception.FilterValidationException;

import java.util.Collection;
import java.util.List;

/**
 * Semantic predicate over a JSON path inside a block's properties, content or
 * metadata. Shape errors are rejected here, when the filter is built, rather
 * than when a query runs.
 */
public record PropertyFilter(String path, Object value, FilterOperator operator) implements FilterExpression {

    public PropertyFilter {
        if (operator == null) {
            operator = FilterOperator.EQUALS;
        }
        JsonPath.parse(path);
        switch (operator) {
            case EQUALS, NOT_EQUALS -> ValueKind.of(value);
            case IN -> value = List.copyOf(validateMembers(value));
            case CONTAINS -> {
                if (!(value instanceof String)) {
                    throw new FilterValidationException("PropertyFilter with operator 'contains' expects a string value.");
                }
            }
        }
    }

    public PropertyFilter(String path, Object value) {
        this(path, value, FilterOperator.EQUALS);
    }

    public static PropertyFilter equalTo(String path, Object value) {
        return new PropertyFilter(path, value, FilterOperator.EQUALS);
    }

    public static PropertyFilter notEqualTo(String path, Object value) {
        return new PropertyFilter(path, value, FilterOperator.NOT_EQUALS);
    }

    public static PropertyFilter in(String path, Collection<?> values) {
        return new PropertyFilter(path, values, FilterOperator.IN);
    }

    public static PropertyFilter contains(String path, String fragment) {
        return new PropertyFilter(path, fragment, FilterOperator.CONTAINS);
    }

    public JsonPath target() {
        return JsonPath.parse(path);
    }

    /** Comparison kind; for {@code in} it follows the first member, widened to float if any member is one. */
    public ValueKind kind() {
        if (operator == FilterOperator.IN) {
            List<?> members = (List<?>) value;
            ValueKind kind = ValueKind.of(members.get(0));
            for (Object member : members) {
                if (ValueKind.of(member) == ValueKind.FLOAT) {
                    return ValueKind.FLOAT;
                }
            }
            return kind;
        }
        return operator == FilterOperator.CONTAINS ? ValueKind.STRING : ValueKind.of(value);
    }

    private static Collection<?> validateMembers(Object value) {
        if (value instanceof CharSequence || !(value instanceof Collection<?> members)) {
            throw new FilterValidationException("PropertyFilter with operator 'in' expects a non-string collection value.");
        }
        if (members.isEmpty()) {
            throw new FilterValidationException("PropertyFilter with operator 'in' requires at least one value.");
        }
        ValueKind first = null;
        for (Object member : members) {
            ValueKind kind = ValueKind.of(member);
            if (first == null) {
                first = kind;
            } else if (!first.accepts(kind) && !kind.accepts(first)) {
                throw new FilterValidationException("PropertyFilter 'in' values must share one type, got "
                    + first + " and " + kind + ".");
            }
        }
        return members;
    }
}
