package com.blockstore.repository.filter;

import com.blockstore.exception.FilterValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.UUID;

/**
 * Comparison type inferred from a filter value. The JSON side of the
 * comparison is cast to the matching SQL type before comparing.
 */
public enum ValueKind {
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING;

    public static ValueKind of(Object value) {
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return INTEGER;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return FLOAT;
        }
        if (value instanceof CharSequence || value instanceof UUID) {
            return STRING;
        }
        throw new FilterValidationException("Unsupported filter value "
            + (value == null ? "null" : "of type " + value.getClass().getSimpleName())
            + "; expected a boolean, number or string.");
    }

    /** Whether a value of {@code other} can be compared under this kind (integers widen to float). */
    public boolean accepts(ValueKind other) {
        return this == other || (this == FLOAT && other == INTEGER);
    }

    public Object normalize(Object value) {
        return switch (this) {
            case BOOLEAN -> value;
            case INTEGER -> ((Number) value).longValue();
            case FLOAT -> ((Number) value).doubleValue();
            case STRING -> value.toString();
        };
    }
}
