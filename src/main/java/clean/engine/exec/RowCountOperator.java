package clean.engine.exec;

import clean.engine.schema.Schema;
import clean.engine.stream.CollectingOperator;
import clean.engine.stream.StreamConsumer;

/** Counts the rows reaching the end of the pipeline. */
public class RowCountOperator extends CollectingOperator {

    @Override
    protected StreamConsumer createConsumer(Schema schema) {
        return new RowCountConsumer(schema);
    }

    @Override
    public String toString() { return "Count"; }
}
