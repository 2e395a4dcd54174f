package clean.engine.exec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingOperator;

/**
 * Moves one or more columns to a new position. The position counts among the
 * columns that are not moved, so 0 puts the moved columns first.
 */
public class MoveOperator extends ProducingOperator {
    private final List<ColumnRef> columns;
    private final int position;

    public MoveOperator(List<ColumnRef> columns, int position) {
        if (columns == null || columns.isEmpty()) throw new PipelineConfigurationException("columns must be non-empty");
        if (position < 0) throw new PipelineConfigurationException("Invalid target position: " + position);
        this.columns = List.copyOf(columns);
        this.position = position;
    }

    /** Input position of each output column. */
    int[] permutation(Schema input) {
        Set<Integer> moved = new LinkedHashSet<>();
        for (int p : input.select(columns)) {
            if (!moved.add(p)) throw new PipelineConfigurationException("Column listed twice: " + input.name(p));
        }
        List<Integer> order = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            if (!moved.contains(i)) order.add(i);
        }
        if (position > order.size()) {
            throw new PipelineConfigurationException("Target position " + position + " out of range for "
                + order.size() + " remaining column(s)");
        }
        order.addAll(position, moved);
        return order.stream().mapToInt(Integer::intValue).toArray();
    }

    @Override
    public Schema outputSchema(Schema input) {
        return input.project(permutation(input));
    }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        int[] positions = permutation(schema);
        return (output, downstream) -> new SelectConsumer(output, downstream, positions);
    }

    @Override
    public String toString() { return "Move" + columns + "@" + position; }
}
