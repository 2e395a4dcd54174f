package clean.engine.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import clean.engine.PipelineConfigurationException;
import clean.engine.function.EvalFunction;
import clean.engine.function.EvalFunctions;
import clean.engine.schema.ColumnRef;
import clean.engine.storage.Table;
import clean.engine.stream.Row;

/**
 * Groups the rows of a table by the value of a key function. Tuple values
 * become tuple keys. Groups refer to rows by row id, so the row ids of the
 * table must be unique.
 */
public class GroupBy {
    private final EvalFunction key;

    public GroupBy(EvalFunction key) {
        if (key == null) throw new IllegalArgumentException("key function must not be null");
        this.key = key;
    }

    public static GroupBy columns(String... columns) {
        return new GroupBy(EvalFunctions.select(ColumnRef.names(columns)));
    }

    public DataGrouping map(Table table) {
        EvalFunction prepared = key.prepare(table);
        Map<Object, List<Object>> groups = new LinkedHashMap<>();
        Set<Object> ids = new HashSet<>();
        for (Row row : table.rows()) {
            if (!ids.add(row.rowId())) {
                throw new PipelineConfigurationException("Cannot group rows with duplicate row id " + row.rowId());
            }
            Object k = prepared.eval(row.values());
            if (k instanceof List<?> tuple) k = Collections.unmodifiableList(new ArrayList<>(tuple));
            groups.computeIfAbsent(k, x -> new ArrayList<>()).add(row.rowId());
        }
        DataGrouping grouping = new DataGrouping(table);
        groups.forEach(grouping::add);
        return grouping;
    }
}
