package clean.engine.exec;

import java.util.ArrayList;
import java.util.List;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingConsumer;
import clean.engine.stream.ProducingOperator;

/**
 * Renames columns. Rows pass through unchanged.
 */
public class RenameOperator extends ProducingOperator {
    private final List<ColumnRef> columns;
    private final List<String> names;

    public RenameOperator(List<ColumnRef> columns, List<String> names) {
        if (columns == null || names == null || columns.isEmpty() || columns.size() != names.size()) {
            throw new PipelineConfigurationException("Rename needs one new name per column");
        }
        this.columns = List.copyOf(columns);
        this.names = List.copyOf(names);
    }

    @Override
    public Schema outputSchema(Schema input) {
        int[] positions = input.select(columns);
        List<String> renamed = new ArrayList<>(input.columns());
        for (int i = 0; i < positions.length; i++) renamed.set(positions[i], names.get(i));
        return new Schema(renamed);
    }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        return (output, downstream) -> new ProducingConsumer(output, downstream) {
            @Override
            protected List<Object> handle(Object rowId, List<Object> row) { return row; }
        };
    }

    @Override
    public String toString() { return "Rename" + columns + "->" + names; }
}
