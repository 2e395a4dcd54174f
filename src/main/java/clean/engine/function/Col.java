package clean.engine.function;

import java.util.List;

import clean.engine.schema.ColumnRef;
import clean.engine.stream.DataSource;

/**
 * Value of a single column. Preparation resolves the column reference against
 * the schema of the data; the resolved position is fixed for the run.
 */
public final class Col implements EvalFunction {
    private final ColumnRef column;
    private final int position; // -1 until prepared

    public Col(ColumnRef column) {
        this(column, -1);
    }

    private Col(ColumnRef column, int position) {
        if (column == null) throw new IllegalArgumentException("column must not be null");
        this.column = column;
        this.position = position;
    }

    public ColumnRef column() { return column; }

    public boolean isPrepared() { return position >= 0; }

    @Override
    public Col prepare(DataSource data) {
        return new Col(column, data.schema().indexOf(column));
    }

    @Override
    public Object eval(List<Object> row) {
        if (position < 0) throw new IllegalStateException("Column " + column + " was not prepared");
        return row.get(position);
    }

    @Override
    public String toString() { return column.toString(); }
}
