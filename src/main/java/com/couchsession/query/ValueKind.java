package com.couchsession.query;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Closed set of value shapes a query option can carry.
 * Computed once per value so conversion never depends on open-ended runtime type lookups.
 */
public enum ValueKind {
    STRING,
    INTEGER,
    BOOLEAN,
    SEQUENCE,
    MAPPING,
    NULL,
    OTHER;

    public static ValueKind of(Object value) {
        if (value == null) {
            return NULL;
        }
        // Boolean is checked before anything numeric so it can never pass as an integer.
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return INTEGER;
        }
        if (value instanceof CharSequence || value instanceof JsCode) {
            return STRING;
        }
        if (value instanceof List<?>) {
            return SEQUENCE;
        }
        if (value instanceof Map<?, ?>) {
            return MAPPING;
        }
        return OTHER;
    }
}
