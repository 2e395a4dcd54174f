package clean.engine.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Row is a pipeline unit: an opaque row identifier and an immutable list of
 * cell values (nulls allowed). Stages never modify a row in place; they build
 * a new value list instead.
 */
public final class Row {
    private final Object rowId;
    private final List<Object> values;

    public Row(Object rowId, List<Object> values) {
        this.rowId = rowId;
        this.values = freeze(values);
    }

    public static Row of(Object rowId, Object... values) {
        return new Row(rowId, Arrays.asList(values));
    }

    /** Unmodifiable copy of the given values; keeps null cells. */
    public static List<Object> freeze(List<?> values) {
        if (values == null) throw new IllegalArgumentException("Row values must not be null");
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Object rowId() { return rowId; }
    public List<Object> values() { return values; }
    public Object get(int index) { return values.get(index); }
    public int size() { return values.size(); }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Row other)) return false;
        return Objects.equals(rowId, other.rowId) && values.equals(other.values);
    }

    @Override
    public int hashCode() { return 31 * Objects.hashCode(rowId) + values.hashCode(); }

    @Override
    public String toString() { return "Row" + values + " id=" + rowId; }
}
