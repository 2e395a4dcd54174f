package clean.engine.exec;

import java.util.List;

import clean.engine.schema.Schema;
import clean.engine.stream.CollectingConsumer;

/** Result: the number of rows as a {@code Long}. */
public class RowCountConsumer extends CollectingConsumer {
    private long count;

    public RowCountConsumer(Schema schema) { super(schema); }

    @Override
    protected void collect(Object rowId, List<Object> row) { count++; }

    @Override
    protected Object result() { return count; }
}
