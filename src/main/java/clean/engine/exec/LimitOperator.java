package clean.engine.exec;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingOperator;

/** Passes on the first n rows, then stops the stream. */
public class LimitOperator extends ProducingOperator {
    private final long limit;

    public LimitOperator(long limit) {
        if (limit < 0) throw new PipelineConfigurationException("Limit must not be negative: " + limit);
        this.limit = limit;
    }

    public long limit() { return limit; }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        return (output, downstream) -> new LimitConsumer(output, downstream, limit);
    }

    @Override
    public String toString() { return "Limit(" + limit + ")"; }
}
