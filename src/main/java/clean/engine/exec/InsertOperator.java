package clean.engine.exec;

import java.util.ArrayList;
import java.util.List;

import clean.engine.PipelineConfigurationException;
import clean.engine.function.EvalFunction;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingOperator;

/**
 * Inserts one or more new columns at a position (-1 appends them). The values
 * come from a function evaluated on the incoming row; several columns take a
 * tuple of matching size.
 */
public class InsertOperator extends ProducingOperator {
    private final List<String> names;
    private final int position;
    private final EvalFunction values;

    public InsertOperator(List<String> names, int position, EvalFunction values) {
        if (names == null || names.isEmpty()) throw new PipelineConfigurationException("Insert needs at least one column name");
        if (values == null) throw new PipelineConfigurationException("Insert needs a value function");
        if (position < -1) throw new PipelineConfigurationException("Invalid insert position: " + position);
        this.names = List.copyOf(names);
        this.position = position;
        this.values = values;
    }

    private int at(Schema input) {
        if (position > input.size()) {
            throw new PipelineConfigurationException("Insert position " + position + " out of range for " + input);
        }
        return position < 0 ? input.size() : position;
    }

    @Override
    public Schema outputSchema(Schema input) {
        List<String> cols = new ArrayList<>(input.columns());
        cols.addAll(at(input), names);
        return new Schema(cols);
    }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        int at = at(schema);
        EvalFunction prepared = values.prepare(upstream);
        return (output, downstream) -> new InsertConsumer(output, downstream, at, names.size(), prepared);
    }

    @Override
    public String toString() { return "Insert" + names + "@" + position; }
}
