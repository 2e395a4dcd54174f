package clean.engine.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import clean.engine.PipelineConfigurationException;

/**
 * Ordered list of column names for the rows produced by a pipeline stage.
 * Names are unique within a schema.
 */
public final class Schema {
    private final List<String> columns;

    public Schema(List<String> columns) {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        Set<String> seen = new HashSet<>();
        for (String c : columns) {
            if (c == null) throw new PipelineConfigurationException("Column name must not be null");
            if (!seen.add(c)) throw new PipelineConfigurationException("Duplicate column name: " + c);
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public static Schema of(String... columns) {
        return new Schema(List.of(columns));
    }

    public List<String> columns() { return columns; }
    public int size() { return columns.size(); }
    public String name(int index) { return columns.get(index); }

    public boolean contains(String name) { return columns.contains(name); }

    /**
     * Resolve a column reference to its index position.
     */
    public int indexOf(ColumnRef ref) {
        if (ref.byName()) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).equals(ref.name())) return i;
            }
            throw new PipelineConfigurationException("Column not found: " + ref.name() + " in " + columns);
        }
        if (ref.index() >= columns.size()) {
            throw new PipelineConfigurationException("Column index " + ref.index() + " out of range for " + columns);
        }
        return ref.index();
    }

    /**
     * Resolve a list of column references into index positions, in reference order.
     */
    public int[] select(List<ColumnRef> refs) {
        if (refs == null || refs.isEmpty()) throw new PipelineConfigurationException("Column list must be non-empty");
        int[] idxs = new int[refs.size()];
        for (int i = 0; i < refs.size(); i++) idxs[i] = indexOf(refs.get(i));
        return idxs;
    }

    /** Schema made of the columns at the given positions. */
    public Schema project(int[] positions) {
        List<String> names = new ArrayList<>(positions.length);
        for (int p : positions) names.add(columns.get(p));
        return new Schema(names);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Schema other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() { return columns.hashCode(); }

    @Override
    public String toString() { return columns.toString(); }
}
