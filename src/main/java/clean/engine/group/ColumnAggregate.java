package clean.engine.group;

import java.util.List;

/**
 * Aggregate over the values of one column of a group. Returns a scalar, or a
 * {@code Map} from key to value that fans out into several columns.
 */
@FunctionalInterface
public interface ColumnAggregate {
    Object apply(List<Object> values);
}
