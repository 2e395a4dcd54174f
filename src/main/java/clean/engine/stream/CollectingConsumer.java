package clean.engine.stream;

import java.util.List;

import clean.engine.schema.Schema;

/**
 * Terminal consumer that accumulates rows into a result. The result is built
 * once, when the consumer is closed; a second close is an error.
 */
public abstract class CollectingConsumer implements StreamConsumer {
    private final Schema schema;
    private boolean closed;

    protected CollectingConsumer(Schema schema) {
        this.schema = schema;
    }

    @Override
    public Schema schema() { return schema; }

    @Override
    public final void consume(Object rowId, List<Object> row) {
        if (closed) throw new IllegalStateException(getClass().getSimpleName() + " is closed");
        collect(rowId, row);
    }

    protected abstract void collect(Object rowId, List<Object> row);

    /** Finalize the accumulator and release its resources. */
    protected abstract Object result();

    @Override
    public final Object close() {
        if (closed) throw new IllegalStateException(getClass().getSimpleName() + " already closed");
        closed = true;
        return result();
    }

    protected boolean isClosed() { return closed; }
}
