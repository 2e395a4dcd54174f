package clean.engine.exec;

import java.util.List;

import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.stream.CollectingOperator;
import clean.engine.stream.StreamConsumer;

/**
 * Counts the distinct values of the given columns (all columns when none are
 * given). A single column yields scalar keys; several yield tuple keys.
 */
public class DistinctOperator extends CollectingOperator {
    private final List<ColumnRef> columns; // null: all columns

    public DistinctOperator() {
        this(null);
    }

    public DistinctOperator(List<ColumnRef> columns) {
        this.columns = columns != null && !columns.isEmpty() ? List.copyOf(columns) : null;
    }

    @Override
    protected StreamConsumer createConsumer(Schema schema) {
        int[] positions;
        if (columns != null) {
            positions = schema.select(columns);
        } else {
            positions = new int[schema.size()];
            for (int i = 0; i < positions.length; i++) positions[i] = i;
        }
        return new DistinctConsumer(schema, positions);
    }

    @Override
    public String toString() { return "Distinct" + (columns != null ? columns : "[*]"); }
}
