package clean.engine.exec;

import java.util.List;

import clean.engine.schema.Schema;
import clean.engine.stream.LimitReachedException;
import clean.engine.stream.ProducingConsumer;
import clean.engine.stream.StreamConsumer;

/**
 * Forwards the first {@code limit} rows. Any row after that raises
 * {@link LimitReachedException}, which ends the stream without an error.
 */
public class LimitConsumer extends ProducingConsumer {
    private final long limit;
    private long count;

    public LimitConsumer(Schema schema, StreamConsumer downstream, long limit) {
        super(schema, downstream);
        this.limit = limit;
    }

    public long count() { return count; }

    @Override
    protected List<Object> handle(Object rowId, List<Object> row) {
        if (count >= limit) throw new LimitReachedException(limit);
        count++;
        return row;
    }
}
