package clean.engine.stream;

import java.util.List;

import clean.engine.schema.Schema;

/**
 * Stateful sink for the rows of one pipeline run. Rows arrive through
 * {@link #consume} in upstream order; {@link #close} is called exactly once
 * after the last row and returns the consumer result.
 * A consumer instance is never reused for a second run.
 */
public interface StreamConsumer {
    /** Schema of the rows this consumer passes on (producers) or collects (collectors). */
    Schema schema();

    void consume(Object rowId, List<Object> row);

    Object close();
}
