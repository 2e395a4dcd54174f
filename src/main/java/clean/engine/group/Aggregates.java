package clean.engine.group;

import java.util.List;

import clean.engine.schema.ColumnRef;

/**
 * Common aggregates. Column aggregates ignore null values; {@link #SUM} keeps
 * integral results as {@code Long}.
 */
public final class Aggregates {
    private Aggregates() {}

    public static final ColumnAggregate COUNT = values -> (long) values.size();

    public static final ColumnAggregate SUM = values -> {
        long lsum = 0;
        double dsum = 0;
        boolean integral = true;
        for (Object v : values) {
            if (v == null) continue;
            Number n = number(v);
            if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte) {
                lsum += n.longValue();
            } else {
                integral = false;
                dsum += n.doubleValue();
            }
        }
        return integral ? (Object) lsum : (Object) (dsum + lsum);
    };

    public static final ColumnAggregate MIN = values -> extreme(values, -1);
    public static final ColumnAggregate MAX = values -> extreme(values, 1);

    public static final ColumnAggregate MEAN = values -> {
        double sum = 0;
        int n = 0;
        for (Object v : values) {
            if (v == null) continue;
            sum += number(v).doubleValue();
            n++;
        }
        return n == 0 ? null : sum / n;
    };

    /** Number of rows in the group. */
    public static AggregateFunction count() {
        return AggregateFunction.of("count", t -> (long) t.size());
    }

    /** Column aggregate applied to one column of the group table. */
    public static AggregateFunction on(String column, String name, ColumnAggregate fn) {
        ColumnRef ref = ColumnRef.name(column);
        return AggregateFunction.of(name, t -> fn.apply(t.column(ref)));
    }

    private static Number number(Object v) {
        if (v instanceof Number n) return n;
        throw new IllegalArgumentException("Not a number: " + v);
    }

    private static Object extreme(List<Object> values, int sign) {
        Object best = null;
        for (Object v : values) {
            if (v == null) continue;
            if (best == null) { best = v; continue; }
            int c;
            if (v instanceof Number a && best instanceof Number b) {
                c = Double.compare(a.doubleValue(), b.doubleValue());
            } else if (v instanceof Comparable<?>) {
                c = comparable(v).compareTo(best);
            } else {
                throw new IllegalArgumentException("Values are not comparable: " + v);
            }
            if (c * sign > 0) best = v;
        }
        return best;
    }

    private static Comparable<Object> comparable(Object value) {
        return (Comparable<Object>) value;
    }
}
