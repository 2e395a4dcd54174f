package clean.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import clean.engine.schema.Schema;
import clean.engine.stream.CollectingConsumer;

/**
 * Frequency count of values. Result: an unmodifiable map from key to
 * {@code Long} count, in order of first occurrence.
 */
public class DistinctConsumer extends CollectingConsumer {
    private final int[] positions;
    private final Map<Object, Long> counts = new LinkedHashMap<>();

    public DistinctConsumer(Schema schema, int[] positions) {
        super(schema);
        if (positions.length == 0) throw new IllegalArgumentException("Distinct needs at least one column");
        this.positions = positions.clone();
    }

    @Override
    protected void collect(Object rowId, List<Object> row) {
        counts.merge(key(row), 1L, Long::sum);
    }

    private Object key(List<Object> row) {
        if (positions.length == 1) return row.get(positions[0]);
        List<Object> key = new ArrayList<>(positions.length);
        for (int p : positions) key.add(row.get(p));
        return Collections.unmodifiableList(key);
    }

    @Override
    protected Object result() { return Collections.unmodifiableMap(counts); }
}
