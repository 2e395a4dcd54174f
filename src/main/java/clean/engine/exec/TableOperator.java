package clean.engine.exec;

import clean.engine.schema.Schema;
import clean.engine.stream.CollectingOperator;
import clean.engine.stream.StreamConsumer;

/** Collects the pipeline output into an in-memory table. */
public class TableOperator extends CollectingOperator {

    @Override
    protected StreamConsumer createConsumer(Schema schema) {
        return new TableConsumer(schema);
    }

    @Override
    public String toString() { return "Table"; }
}
