package clean.engine.exec;

import clean.engine.function.EvalFunction;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingOperator;

/**
 * Operator that passes on the rows for which a predicate evaluates to the
 * truth value ({@code Boolean.TRUE} unless configured otherwise). A negated
 * filter passes on the other rows instead, which is how rows are deleted.
 */
public class FilterOperator extends ProducingOperator {
    private final EvalFunction predicate;
    private final Object truthValue;
    private final boolean negated;

    public FilterOperator(EvalFunction predicate) {
        this(predicate, Boolean.TRUE, false);
    }

    public FilterOperator(EvalFunction predicate, Object truthValue, boolean negated) {
        if (predicate == null) throw new IllegalArgumentException("predicate must not be null");
        if (truthValue == null) throw new IllegalArgumentException("truth value must not be null");
        this.predicate = predicate;
        this.truthValue = truthValue;
        this.negated = negated;
    }

    public static FilterOperator delete(EvalFunction predicate) {
        return new FilterOperator(predicate, Boolean.TRUE, true);
    }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        EvalFunction prepared = predicate.prepare(upstream);
        return (output, downstream) -> new FilterConsumer(output, downstream, prepared, truthValue, negated);
    }

    @Override
    public String toString() { return (negated ? "Delete(" : "Filter(") + predicate + ")"; }
}
