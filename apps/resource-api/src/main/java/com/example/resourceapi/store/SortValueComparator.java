package com.example.resourceapi.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Orders field values the way MongoDB orders BSON types: missing/null, numbers, strings, documents,
 * arrays, booleans, dates. Values of the same type compare naturally.
 */
public final class SortValueComparator implements Comparator<Object> {

    public static final SortValueComparator INSTANCE = new SortValueComparator();

    private SortValueComparator() {}

    @Override
    public int compare(Object left, Object right) {
        int rank = Integer.compare(typeRank(left), typeRank(right));
        if (rank != 0) {
            return rank;
        }
        if (left == null) {
            return 0;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return toBigDecimal(a).compareTo(toBigDecimal(b));
        }
        if (left instanceof String a && right instanceof String b) {
            return a.compareTo(b);
        }
        if (left instanceof Boolean a && right instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        if (isDate(left)) {
            return toInstant(left).compareTo(toInstant(right));
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static int typeRank(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return 1;
        }
        if (value instanceof CharSequence) {
            return 2;
        }
        if (value instanceof Map) {
            return 3;
        }
        if (value instanceof List) {
            return 4;
        }
        if (value instanceof Boolean) {
            return 5;
        }
        if (isDate(value)) {
            return 6;
        }
        return 7;
    }

    private static boolean isDate(Object value) {
        return value instanceof Instant || value instanceof Date;
    }

    private static Instant toInstant(Object value) {
        return value instanceof Date date ? date.toInstant() : (Instant) value;
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof Double || number instanceof Float) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return BigDecimal.valueOf(number.longValue());
    }
}
