package clean.engine.function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import clean.engine.schema.ColumnRef;
import clean.engine.stream.DataSource;

/**
 * Tuple of values from several columns, in reference order.
 */
public final class Cols implements EvalFunction {
    private final List<ColumnRef> columns;
    private final int[] positions; // null until prepared

    public Cols(List<ColumnRef> columns) {
        this(columns, null);
    }

    private Cols(List<ColumnRef> columns, int[] positions) {
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("columns must be non-empty");
        this.columns = List.copyOf(columns);
        this.positions = positions;
    }

    public List<ColumnRef> columns() { return columns; }

    @Override
    public Cols prepare(DataSource data) {
        return new Cols(columns, data.schema().select(columns));
    }

    @Override
    public Object eval(List<Object> row) {
        if (positions == null) throw new IllegalStateException("Columns " + columns + " were not prepared");
        List<Object> values = new ArrayList<>(positions.length);
        for (int p : positions) values.add(row.get(p));
        return Collections.unmodifiableList(values);
    }

    @Override
    public String toString() { return columns.toString(); }
}
