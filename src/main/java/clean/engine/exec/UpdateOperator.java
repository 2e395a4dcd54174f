package clean.engine.exec;

import java.util.List;

import clean.engine.PipelineConfigurationException;
import clean.engine.function.EvalFunction;
import clean.engine.function.EvalFunctions;
import clean.engine.function.IfThenReplace;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingOperator;

/**
 * Replaces the values of one or more columns with the result of a function.
 * A conditional replacement without an else-branch keeps the current values
 * of the updated columns for rows that do not match.
 */
public class UpdateOperator extends ProducingOperator {
    private final List<ColumnRef> columns;
    private final EvalFunction fn;

    public UpdateOperator(List<ColumnRef> columns, EvalFunction fn) {
        if (columns == null || columns.isEmpty()) throw new PipelineConfigurationException("columns must be non-empty");
        if (fn == null) throw new PipelineConfigurationException("Update needs a value function");
        this.columns = List.copyOf(columns);
        this.fn = fn instanceof IfThenReplace cond && !cond.hasPassThrough()
            ? cond.withPassThrough(EvalFunctions.select(columns))
            : fn;
    }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        int[] positions = schema.select(columns);
        EvalFunction prepared = fn.prepare(upstream);
        return (output, downstream) -> new UpdateConsumer(output, downstream, positions, prepared);
    }

    @Override
    public String toString() { return "Update" + columns + "=" + fn; }
}
