package clean.engine.stream;

import java.util.List;

import clean.engine.schema.Schema;

/**
 * Consumer that handles a row and passes the result on to an optional
 * downstream consumer. The result of a producer is the result of its
 * downstream consumer (null when there is none).
 */
public abstract class ProducingConsumer implements StreamConsumer {
    private final Schema schema;
    private final StreamConsumer downstream; // null for a dangling producer
    private boolean closed;

    protected ProducingConsumer(Schema schema, StreamConsumer downstream) {
        this.schema = schema;
        this.downstream = downstream;
    }

    @Override
    public Schema schema() { return schema; }

    public StreamConsumer downstream() { return downstream; }

    @Override
    public void consume(Object rowId, List<Object> row) {
        if (closed) throw new IllegalStateException(getClass().getSimpleName() + " is closed");
        List<Object> out = handle(rowId, row);
        if (out != null) forward(rowId, out);
    }

    /**
     * Process a row. Returns the row to pass downstream, or null to drop it.
     */
    protected abstract List<Object> handle(Object rowId, List<Object> row);

    protected final void forward(Object rowId, List<Object> row) {
        if (downstream != null) downstream.consume(rowId, row);
    }

    /**
     * Drain any buffered rows, then close the downstream consumer. The
     * downstream consumer is closed even when draining fails; a failure while
     * doing so is attached to the draining error as suppressed.
     */
    @Override
    public Object close() {
        if (closed) throw new IllegalStateException(getClass().getSimpleName() + " already closed");
        closed = true;
        try {
            flush();
        } catch (RuntimeException | Error e) {
            if (downstream != null) {
                try {
                    downstream.close();
                } catch (RuntimeException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw e;
        }
        return downstream != null ? downstream.close() : null;
    }

    /** Hook for producers that hold rows back until the end of the stream. */
    protected void flush() {}
}
