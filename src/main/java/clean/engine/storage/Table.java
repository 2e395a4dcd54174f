package clean.engine.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.Row;
import clean.engine.stream.RowReader;

/**
 * In-memory table: a schema plus an ordered list of rows with their row ids.
 * Tables are immutable and can be streamed any number of times.
 */
public final class Table implements DataSource {
    private final Schema schema;
    private final List<Row> rows;

    public Table(Schema schema, List<Row> rows) {
        if (schema == null) throw new IllegalArgumentException("schema must not be null");
        for (Row r : rows) {
            if (r.size() != schema.size()) {
                throw new PipelineConfigurationException("Row " + r.rowId() + " has " + r.size()
                    + " values, expected " + schema.size());
            }
        }
        this.schema = schema;
        this.rows = List.copyOf(rows);
    }

    /** Table with row ids 0..n-1 (as {@code Long}). */
    public static Table of(List<String> columns, List<? extends List<?>> values) {
        List<Row> rows = new ArrayList<>(values.size());
        long id = 0;
        for (List<?> v : values) rows.add(new Row(id++, Row.freeze(v)));
        return new Table(new Schema(columns), rows);
    }

    public static Table empty(Schema schema) {
        return new Table(schema, List.of());
    }

    @Override
    public Schema schema() { return schema; }

    public List<Row> rows() { return rows; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
    public Row row(int i) { return rows.get(i); }

    public List<Object> rowIds() {
        List<Object> ids = new ArrayList<>(rows.size());
        for (Row r : rows) ids.add(r.rowId());
        return Collections.unmodifiableList(ids);
    }

    /** Values of one column in row order. */
    public List<Object> column(ColumnRef ref) {
        int idx = schema.indexOf(ref);
        List<Object> values = new ArrayList<>(rows.size());
        for (Row r : rows) values.add(r.get(idx));
        return Collections.unmodifiableList(values);
    }

    public List<Object> column(String name) { return column(ColumnRef.name(name)); }

    /**
     * Rows with the given ids, in the order of the id list.
     *
     * @throws IllegalArgumentException for an id that is not in the table
     * @throws PipelineConfigurationException for an id shared by several rows
     */
    public Table subset(List<?> rowIds) {
        Map<Object, Row> byId = new HashMap<>();
        Set<Object> shared = new HashSet<>();
        for (Row r : rows) {
            if (byId.putIfAbsent(r.rowId(), r) != null) shared.add(r.rowId());
        }
        List<Row> selected = new ArrayList<>(rowIds.size());
        for (Object id : rowIds) {
            if (shared.contains(id)) throw new PipelineConfigurationException("Row id " + id + " is not unique");
            Row r = byId.get(id);
            if (r == null) throw new IllegalArgumentException("Unknown row id: " + id);
            selected.add(r);
        }
        return new Table(schema, selected);
    }

    @Override
    public RowReader open() {
        Iterator<Row> it = rows.iterator();
        return new RowReader() {
            @Override
            public boolean hasNext() { return it.hasNext(); }

            @Override
            public Row next() {
                if (!it.hasNext()) throw new NoSuchElementException();
                return it.next();
            }

            @Override
            public void close() {}
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Table other && schema.equals(other.schema) && rows.equals(other.rows);
    }

    @Override
    public int hashCode() { return 31 * schema.hashCode() + rows.hashCode(); }

    @Override
    public String toString() { return "Table" + schema + " rows=" + rows.size(); }
}
