package clean.engine.stream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import clean.engine.schema.Schema;

/**
 * A row source combined with an ordered list of stream operators.
 * <p>
 * {@link #run()} drives the source through the consumer chain and returns the
 * result of the terminal consumer; {@link #open()} streams the rows that leave
 * the last operator lazily. A data stream is itself a data source, which is how
 * upstream rows are handed to evaluation functions during preparation.
 */
public class DataStream implements DataSource {
    private static final Logger LOG = LoggerFactory.getLogger(DataStream.class);

    private final DataSource source;
    private final List<StreamOperator> operators;
    private final Schema schema;

    public DataStream(DataSource source) {
        this(source, List.of());
    }

    public DataStream(DataSource source, List<StreamOperator> operators) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        this.source = source;
        this.operators = List.copyOf(operators);
        Schema s = source.schema();
        for (StreamOperator op : this.operators) s = op.outputSchema(s);
        this.schema = s;
    }

    public DataSource source() { return source; }
    public List<StreamOperator> operators() { return operators; }

    @Override
    public Schema schema() { return schema; }

    /** New stream with the operator appended; this stream is unchanged. */
    public DataStream append(StreamOperator op) {
        List<StreamOperator> ops = new ArrayList<>(operators);
        ops.add(op);
        return new DataStream(source, ops);
    }

    /**
     * Open the consumer chain for all operators and return its head.
     * Every operator is opened (and its functions prepared) before this returns.
     */
    public static StreamConsumer openChain(DataSource source, List<StreamOperator> ops) {
        if (ops.isEmpty()) throw new IllegalStateException("Cannot open an empty operator chain");
        return ops.get(0).open(source, source.schema(), List.of(), ops.subList(1, ops.size()));
    }

    /**
     * Stream all source rows through the operators and return the result of
     * the terminal consumer. Returns null for a stream without operators.
     * The chain is fully opened before the first row is read, a limit signal
     * ends the stream normally, and the chain is closed exactly once.
     */
    public Object run() {
        if (operators.isEmpty()) return null;
        StreamConsumer consumer = openChain(source, operators);
        LOG.debug("Opened pipeline of {} operator(s) over schema {}", operators.size(), source.schema());
        long count = 0;
        try (RowReader reader = source.open()) {
            while (reader.hasNext()) {
                Row row = reader.next();
                count++;
                try {
                    consumer.consume(row.rowId(), row.values());
                } catch (LimitReachedException e) {
                    LOG.debug("Stopping after {} row(s): {}", count, e.getMessage());
                    break;
                }
            }
        } catch (RuntimeException | Error e) {
            closeAfterFailure(consumer, e);
            throw e;
        }
        LOG.debug("Streamed {} row(s)", count);
        return consumer.close();
    }

    private static void closeAfterFailure(StreamConsumer consumer, Throwable failure) {
        try {
            consumer.close();
        } catch (RuntimeException suppressed) {
            LOG.warn("Failed closing consumer chain after error: {}", suppressed.getMessage());
            failure.addSuppressed(suppressed);
        }
    }

    /**
     * Lazily iterate over the rows produced by the last operator. Rows that
     * consumers release only when closed (a sample, for example) are returned
     * after the source is exhausted.
     */
    @Override
    public RowReader open() {
        if (operators.isEmpty()) return source.open();
        return new PipelineReader();
    }

    /**
     * Reader that pulls source rows until the chain emits at least one row.
     * The chain ends in a buffering collector that hands rows to the reader.
     */
    private final class PipelineReader implements RowReader {
        private final Deque<Row> buffer = new ArrayDeque<>();
        private RowReader input;
        private StreamConsumer consumer;
        private boolean opened;
        private boolean exhausted;
        private boolean closed;

        private void ensureOpen() {
            if (opened) return;
            List<StreamOperator> ops = new ArrayList<>(operators);
            ops.add(new BufferOperator(buffer));
            consumer = openChain(source, ops);
            try {
                input = source.open();
            } catch (RuntimeException e) {
                closeAfterFailure(consumer, e);
                throw e;
            }
            opened = true;
        }

        private void advance() {
            if (input.hasNext()) {
                Row row = input.next();
                try {
                    consumer.consume(row.rowId(), row.values());
                } catch (LimitReachedException e) {
                    finish();
                }
            } else {
                finish();
            }
        }

        private void finish() {
            exhausted = true;
            input.close();
            consumer.close();
        }

        @Override
        public boolean hasNext() {
            if (closed) return false;
            ensureOpen();
            while (buffer.isEmpty() && !exhausted) {
                try {
                    advance();
                } catch (RuntimeException e) {
                    close();
                    throw e;
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public Row next() {
            if (!hasNext()) throw new NoSuchElementException();
            return buffer.poll();
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            if (opened && !exhausted) {
                exhausted = true;
                input.close();
                consumer.close();
            }
            buffer.clear();
        }
    }

    /** Terminal stage of a pipeline reader; queues every row it receives. */
    private static final class BufferOperator extends CollectingOperator {
        private final Deque<Row> buffer;

        BufferOperator(Deque<Row> buffer) { this.buffer = buffer; }

        @Override
        protected StreamConsumer createConsumer(Schema schema) {
            return new CollectingConsumer(schema) {
                @Override
                protected void collect(Object rowId, List<Object> row) { buffer.add(new Row(rowId, row)); }

                @Override
                protected Object result() { return null; }
            };
        }
    }
}
