package clean.engine.group;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.storage.Table;
import clean.engine.stream.Row;

/**
 * Reduces a grouping to a table with one row per group key.
 * <p>
 * With a single {@link AggregateFunction} the function sees the whole group
 * table; a scalar result becomes one column named after the function, a
 * {@code Map} result becomes one column per map key. With a per-column map of
 * {@link ColumnAggregate}s each function sees the values of its column; a
 * scalar result becomes a column named after the input column, a {@code Map}
 * result becomes columns named {@code column.key}. Columns appear in order of
 * first occurrence; cells a group does not produce are null.
 * <p>
 * An explicit output schema renames the columns and must have exactly as many
 * names as there are result columns. The row id of each output row is the
 * group key.
 */
public class Aggregate {
    private static final Logger LOG = LoggerFactory.getLogger(Aggregate.class);

    private final AggregateFunction function; // single function form
    private final Map<String, ColumnAggregate> perColumn; // per-column form
    private final List<String> schema; // nullable

    public Aggregate(AggregateFunction function) {
        this(function, null);
    }

    public Aggregate(AggregateFunction function, List<String> schema) {
        if (function == null) throw new PipelineConfigurationException("Aggregate function must not be null");
        this.function = function;
        this.perColumn = null;
        this.schema = schema != null ? List.copyOf(schema) : null;
    }

    public Aggregate(Map<String, ColumnAggregate> perColumn, List<String> schema) {
        if (perColumn == null || perColumn.isEmpty()) {
            throw new PipelineConfigurationException("At least one column aggregate is required");
        }
        this.function = null;
        this.perColumn = new LinkedHashMap<>(perColumn);
        this.schema = schema != null ? List.copyOf(schema) : null;
    }

    public Table reduce(DataGrouping groups) {
        if (perColumn != null) {
            Schema input = groups.table().schema();
            for (String col : perColumn.keySet()) {
                if (!input.contains(col)) throw new PipelineConfigurationException("Aggregation column not found: " + col);
            }
        }
        Set<String> columns = new LinkedHashSet<>();
        Map<Object, Map<String, Object>> cells = new LinkedHashMap<>();
        for (Map.Entry<Object, Table> group : groups.groups().entrySet()) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (function != null) {
                fanOut(function.name(), null, function.apply(group.getValue()), row);
            } else {
                for (Map.Entry<String, ColumnAggregate> e : perColumn.entrySet()) {
                    List<Object> values = group.getValue().column(ColumnRef.name(e.getKey()));
                    fanOut(e.getKey(), e.getKey(), e.getValue().apply(values), row);
                }
            }
            columns.addAll(row.keySet());
            cells.put(group.getKey(), row);
        }
        List<String> names = new ArrayList<>(columns);
        if (schema != null && schema.size() != names.size()) {
            throw new PipelineConfigurationException("Invalid schema " + schema + " for aggregate result with "
                + names.size() + " column(s) " + names);
        }
        List<Row> rows = new ArrayList<>(cells.size());
        for (Map.Entry<Object, Map<String, Object>> e : cells.entrySet()) {
            List<Object> values = new ArrayList<>(names.size());
            for (String name : names) values.add(e.getValue().get(name));
            rows.add(new Row(e.getKey(), values));
        }
        LOG.debug("Aggregated {} group(s) into columns {}", rows.size(), names);
        return new Table(new Schema(schema != null ? schema : names), rows);
    }

    /**
     * Put a function result into the output row. Map results fan out; the keys
     * are prefixed with {@code prefix} when given.
     */
    private static void fanOut(String name, String prefix, Object result, Map<String, Object> row) {
        if (result instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> e : map.entrySet()) {
                String key = String.valueOf(e.getKey());
                row.put(prefix != null ? prefix + "." + key : key, e.getValue());
            }
        } else if (result instanceof Collection<?>) {
            throw new PipelineConfigurationException("Aggregate " + name + " returned a collection; expected a scalar or a map");
        } else {
            row.put(name, result);
        }
    }
}
