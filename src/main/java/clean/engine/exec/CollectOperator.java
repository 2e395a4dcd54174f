package clean.engine.exec;

import java.util.function.Function;

import clean.engine.schema.Schema;
import clean.engine.stream.CollectingOperator;
import clean.engine.stream.StreamConsumer;

/**
 * Terminal stage backed by an arbitrary consumer. The factory is called once
 * per pipeline run with the schema of the incoming rows.
 */
public class CollectOperator extends CollectingOperator {
    private final Function<Schema, ? extends StreamConsumer> factory;

    public CollectOperator(Function<Schema, ? extends StreamConsumer> factory) {
        if (factory == null) throw new IllegalArgumentException("factory must not be null");
        this.factory = factory;
    }

    @Override
    protected StreamConsumer createConsumer(Schema schema) {
        StreamConsumer consumer = factory.apply(schema);
        if (consumer == null) throw new IllegalStateException("Consumer factory returned null");
        return consumer;
    }
}
