package clean.engine.exec;

import java.util.ArrayList;
import java.util.List;

import clean.engine.schema.Schema;
import clean.engine.storage.Table;
import clean.engine.stream.CollectingConsumer;
import clean.engine.stream.Row;

/** Result: a {@link Table} holding the rows and their row ids. */
public class TableConsumer extends CollectingConsumer {
    private final List<Row> rows = new ArrayList<>();

    public TableConsumer(Schema schema) { super(schema); }

    @Override
    protected void collect(Object rowId, List<Object> row) {
        rows.add(new Row(rowId, row));
    }

    @Override
    protected Object result() { return new Table(schema(), rows); }
}
