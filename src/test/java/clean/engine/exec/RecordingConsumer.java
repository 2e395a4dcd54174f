package clean.engine.exec;

import java.util.ArrayList;
import java.util.List;

import clean.engine.schema.Schema;
import clean.engine.stream.CollectingConsumer;
import clean.engine.stream.Row;

/** Collector that keeps every row it receives, for assertions. */
class RecordingConsumer extends CollectingConsumer {
    final List<Row> rows = new ArrayList<>();
    int closeCalls;

    RecordingConsumer(Schema schema) { super(schema); }

    @Override
    protected void collect(Object rowId, List<Object> row) { rows.add(new Row(rowId, row)); }

    @Override
    protected Object result() {
        closeCalls++;
        return rows.size();
    }
}
