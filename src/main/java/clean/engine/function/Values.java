package clean.engine.function;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Value helpers shared by the evaluation functions.
 */
final class Values {
    private Values() {}

    static boolean isNumeric(Object value) {
        return value instanceof Number;
    }

    static double toDouble(Object value) {
        return ((Number) value).doubleValue();
    }

    static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value);
    }

    static boolean isEmpty(Object value, boolean ignoreWhitespace) {
        if (value == null) return true;
        if (value instanceof String s) return ignoreWhitespace ? s.isBlank() : s.isEmpty();
        return false;
    }

    static Object lowerCase(Object value) {
        if (value instanceof String s) return s.toLowerCase(Locale.ROOT);
        if (value instanceof List<?> list) return list.stream().map(Values::lowerCase).toList();
        return value;
    }

    /**
     * Equality with numeric widening, so that 1 and 1L compare equal.
     */
    static boolean same(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (isNumeric(a) && isNumeric(b)) return compareNumbers((Number) a, (Number) b) == 0;
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) return false;
            for (int i = 0; i < la.size(); i++) {
                if (!same(la.get(i), lb.get(i))) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    /**
     * Order two values. Numbers compare numerically, lists lexicographically,
     * other values through {@link Comparable} when they share a class.
     *
     * @throws ClassCastException if the values cannot be ordered
     */
    static int compare(Object a, Object b) {
        if (a == null || b == null) throw new ClassCastException("Cannot order null values");
        if (isNumeric(a) && isNumeric(b)) return compareNumbers((Number) a, (Number) b);
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            int n = Math.min(la.size(), lb.size());
            for (int i = 0; i < n; i++) {
                int c = compare(la.get(i), lb.get(i));
                if (c != 0) return c;
            }
            return Integer.compare(la.size(), lb.size());
        }
        if (a.getClass() == b.getClass() && a instanceof Comparable<?>) return comparable(a).compareTo(b);
        throw new ClassCastException("Cannot compare " + a.getClass().getSimpleName()
            + " with " + b.getClass().getSimpleName());
    }

    /** Exact for decimals; NaN and infinities fall back to double ordering. */
    private static int compareNumbers(Number a, Number b) {
        if ((a instanceof BigDecimal || b instanceof BigDecimal) && isFinite(a) && isFinite(b)) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isFinite(Number n) {
        if (n instanceof Double || n instanceof Float) return Double.isFinite(n.doubleValue());
        return true;
    }

    /** View of a value as comparable with values of its own class. */
    static Comparable<Object> comparable(Object value) {
        return (Comparable<Object>) value;
    }
}
