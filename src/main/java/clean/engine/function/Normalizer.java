package clean.engine.function;

import java.util.DoubleSummaryStatistics;
import java.util.List;

import clean.engine.stream.DataSource;
import clean.engine.stream.Row;
import clean.engine.stream.RowReader;

/**
 * Base class for functions that rescale numeric values using statistics over
 * the whole column. Preparation evaluates the argument on every row of the
 * data, collects the numeric values and returns a new prepared instance; the
 * unprepared receiver can be reused. Non-numeric values are ignored when
 * collecting statistics and handed to the error policy during evaluation.
 */
public abstract class Normalizer implements EvalFunction {
    protected final EvalFunction arg;
    protected final DataErrorPolicy onError;
    private final DoubleSummaryStatistics stats; // null until prepared

    protected Normalizer(EvalFunction arg, DataErrorPolicy onError, DoubleSummaryStatistics stats) {
        if (arg == null) throw new IllegalArgumentException("arg must not be null");
        this.arg = arg;
        this.onError = onError != null ? onError : DataErrorPolicy.raise();
        this.stats = stats;
    }

    /** New instance with the given prepared argument and statistics. */
    protected abstract Normalizer withStatistics(EvalFunction arg, DoubleSummaryStatistics stats);

    protected abstract double normalize(double value, DoubleSummaryStatistics stats);

    public boolean isPrepared() { return stats != null; }

    @Override
    public Normalizer prepare(DataSource data) {
        EvalFunction prepared = arg.prepare(data);
        DoubleSummaryStatistics s = new DoubleSummaryStatistics();
        try (RowReader reader = data.open()) {
            while (reader.hasNext()) {
                Row row = reader.next();
                Object v = prepared.eval(row.values());
                if (Values.isNumeric(v)) s.accept(Values.toDouble(v));
            }
        }
        return withStatistics(prepared, s);
    }

    @Override
    public Object eval(List<Object> row) {
        if (stats == null) throw new IllegalStateException(getClass().getSimpleName() + " was not prepared");
        Object value = arg.eval(row);
        if (!Values.isNumeric(value)) {
            return onError.handle(value, "Cannot normalize non-numeric value: " + value);
        }
        return normalize(Values.toDouble(value), stats);
    }

    @Override
    public String toString() { return getClass().getSimpleName() + "(" + arg + ")"; }
}
