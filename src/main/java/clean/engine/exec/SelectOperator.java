package clean.engine.exec;

import java.util.List;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingOperator;

/**
 * Projection operator: selects a subset of columns, in the given order, and
 * optionally gives them new names. Row ids are kept.
 */
public class SelectOperator extends ProducingOperator {
    private final List<ColumnRef> columns;
    private final List<String> names; // nullable

    public SelectOperator(List<ColumnRef> columns) {
        this(columns, null);
    }

    public SelectOperator(List<ColumnRef> columns, List<String> names) {
        if (columns == null || columns.isEmpty()) throw new PipelineConfigurationException("columns must be non-empty");
        if (names != null && names.size() != columns.size()) {
            throw new PipelineConfigurationException("Got " + names.size() + " names for " + columns.size() + " columns");
        }
        this.columns = List.copyOf(columns);
        this.names = names != null ? List.copyOf(names) : null;
    }

    @Override
    public Schema outputSchema(Schema input) {
        return names != null ? new Schema(names) : input.project(input.select(columns));
    }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        int[] positions = schema.select(columns);
        return (output, downstream) -> new SelectConsumer(output, downstream, positions);
    }

    @Override
    public String toString() { return "Select" + columns; }
}
