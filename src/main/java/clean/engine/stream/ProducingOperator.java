package clean.engine.stream;

import java.util.ArrayList;
import java.util.List;

import clean.engine.schema.Schema;

/**
 * Base class for operators whose consumers pass rows on downstream.
 * Opening runs in a fixed order: functions are prepared against the upstream
 * data first, the downstream chain is opened next, and the consumer is bound
 * to it last. A failing preparation therefore aborts before any downstream
 * resource (such as an output file) is acquired.
 */
public abstract class ProducingOperator implements StreamOperator {

    /** Binds a prepared stage to its output schema and downstream consumer. */
    @FunctionalInterface
    protected interface ConsumerBinding {
        ProducingConsumer bind(Schema output, StreamConsumer downstream);
    }

    /**
     * Resolve columns and prepare evaluation functions for this stage.
     *
     * @param upstream rows arriving at this stage (source streamed through the upstream operators)
     * @param schema   schema of those rows
     */
    protected abstract ConsumerBinding prepare(DataSource upstream, Schema schema);

    @Override
    public final StreamConsumer open(DataSource source, Schema schema,
                                     List<StreamOperator> upstream, List<StreamOperator> downstream) {
        DataSource data = upstream.isEmpty() ? source : new DataStream(source, upstream);
        Schema output = outputSchema(schema);
        ConsumerBinding binding = prepare(data, schema);
        StreamConsumer next = null;
        if (!downstream.isEmpty()) {
            List<StreamOperator> chain = new ArrayList<>(upstream);
            chain.add(this);
            next = downstream.get(0).open(source, output, chain, downstream.subList(1, downstream.size()));
        }
        return binding.bind(output, next);
    }
}
