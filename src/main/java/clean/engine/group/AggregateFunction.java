package clean.engine.group;

import java.util.function.Function;

import clean.engine.storage.Table;

/**
 * Aggregate over the whole table of a group. Returns a scalar, or a
 * {@code Map} from output column name to value.
 */
public interface AggregateFunction {

    /** Output column name for scalar results. */
    String name();

    Object apply(Table group);

    static AggregateFunction of(String name, Function<Table, Object> fn) {
        return new AggregateFunction() {
            @Override
            public String name() { return name; }

            @Override
            public Object apply(Table group) { return fn.apply(group); }

            @Override
            public String toString() { return name; }
        };
    }
}
