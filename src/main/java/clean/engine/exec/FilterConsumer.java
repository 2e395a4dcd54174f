package clean.engine.exec;

import java.util.List;

import clean.engine.PipelineConfigurationException;
import clean.engine.function.EvalFunction;
import clean.engine.schema.Schema;
import clean.engine.stream.ProducingConsumer;
import clean.engine.stream.StreamConsumer;

/**
 * Forwards rows whose predicate value equals the truth value. A predicate
 * value of another type than the truth value is rejected, so a predicate that
 * can never match fails loudly instead of dropping every row. Null counts as
 * no match.
 */
public class FilterConsumer extends ProducingConsumer {
    private final EvalFunction predicate;
    private final Object truthValue;
    private final boolean negated;

    public FilterConsumer(Schema schema, StreamConsumer downstream, EvalFunction predicate,
                          Object truthValue, boolean negated) {
        super(schema, downstream);
        this.predicate = predicate;
        this.truthValue = truthValue;
        this.negated = negated;
    }

    @Override
    protected List<Object> handle(Object rowId, List<Object> row) {
        Object value = predicate.eval(row);
        if (value != null && value.getClass() != truthValue.getClass()) {
            throw new PipelineConfigurationException("Predicate " + predicate + " returned "
                + value.getClass().getSimpleName() + " value '" + value + "' but the truth value is "
                + truthValue.getClass().getSimpleName() + " '" + truthValue + "'");
        }
        boolean match = truthValue.equals(value);
        return match != negated ? row : null;
    }
}
