package clean.engine.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import clean.engine.schema.Schema;
import clean.engine.stream.LimitReachedException;
import clean.engine.stream.ProducingConsumer;
import clean.engine.stream.StreamConsumer;

/**
 * Reservoir sampling. Rows are held back until the stream ends and are then
 * forwarded in their original order, before the downstream chain is closed.
 */
public class SampleConsumer extends ProducingConsumer {
    private static final Logger LOG = LoggerFactory.getLogger(SampleConsumer.class);

    private record Entry(long seq, Object rowId, List<Object> row) {}

    private final int size;
    private final Random random;
    private final List<Entry> reservoir;
    private long seen;

    public SampleConsumer(Schema schema, StreamConsumer downstream, int size, Random random) {
        super(schema, downstream);
        this.size = size;
        this.random = random;
        this.reservoir = new ArrayList<>(Math.min(size, 1024));
    }

    @Override
    protected List<Object> handle(Object rowId, List<Object> row) {
        long seq = seen++;
        if (reservoir.size() < size) {
            reservoir.add(new Entry(seq, rowId, row));
        } else if (size > 0) {
            long j = (long) (random.nextDouble() * seen);
            if (j < size) reservoir.set((int) j, new Entry(seq, rowId, row));
        }
        return null;
    }

    @Override
    protected void flush() {
        reservoir.sort(Comparator.comparingLong(Entry::seq));
        try {
            for (Entry e : reservoir) forward(e.rowId(), e.row());
        } catch (LimitReachedException e) {
            LOG.debug("Dropping rest of sample of {} row(s): {}", reservoir.size(), e.getMessage());
        }
        reservoir.clear();
    }
}
