package clean.engine.stream;

import java.util.List;

import clean.engine.schema.Schema;

/**
 * Stateless description of a pipeline stage. Opening an operator against the
 * schema of its input yields a fresh consumer; the same operator can be opened
 * any number of times for independent runs.
 */
public interface StreamOperator {

    /**
     * Schema of the rows this stage emits for the given input schema.
     * Schema-only: must not read rows.
     */
    default Schema outputSchema(Schema input) { return input; }

    /**
     * Create the consumer for this stage and, recursively, for the downstream
     * stages.
     *
     * @param source     the source feeding the whole chain
     * @param schema     schema of the rows this stage receives
     * @param upstream   operators between the source and this stage
     * @param downstream operators after this stage, in order
     */
    StreamConsumer open(DataSource source, Schema schema, List<StreamOperator> upstream, List<StreamOperator> downstream);
}
