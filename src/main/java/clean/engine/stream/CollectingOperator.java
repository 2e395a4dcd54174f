package clean.engine.stream;

import java.util.List;

import clean.engine.schema.Schema;

/**
 * Base class for terminal operators. A collector ends the chain: any
 * downstream operators handed to it are ignored.
 */
public abstract class CollectingOperator implements StreamOperator {

    protected abstract StreamConsumer createConsumer(Schema schema);

    @Override
    public final StreamConsumer open(DataSource source, Schema schema,
                                     List<StreamOperator> upstream, List<StreamOperator> downstream) {
        return createConsumer(schema);
    }
}
