package clean.engine.profile;

import java.util.List;

import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.stream.CollectingOperator;
import clean.engine.stream.StreamConsumer;

/**
 * Profiles the values of the given columns (all columns when none are given).
 * The result is the list of column profiles in column order.
 */
public class ProfileOperator extends CollectingOperator {
    private final List<ColumnRef> columns; // null: all columns

    public ProfileOperator() {
        this(null);
    }

    public ProfileOperator(List<ColumnRef> columns) {
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
        return new ProfileConsumer(schema, positions);
    }

    @Override
    public String toString() { return "Profile" + (columns != null ? columns : "[*]"); }
}
