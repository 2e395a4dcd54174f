package clean.engine.function;

import java.util.DoubleSummaryStatistics;

/** Divides values by the column sum; a zero sum yields 0. */
public final class DivideByTotal extends Normalizer {

    public DivideByTotal(EvalFunction arg) {
        this(arg, DataErrorPolicy.raise());
    }

    public DivideByTotal(EvalFunction arg, DataErrorPolicy onError) {
        super(arg, onError, null);
    }

    private DivideByTotal(EvalFunction arg, DataErrorPolicy onError, DoubleSummaryStatistics stats) {
        super(arg, onError, stats);
    }

    @Override
    protected Normalizer withStatistics(EvalFunction arg, DoubleSummaryStatistics stats) {
        return new DivideByTotal(arg, onError, stats);
    }

    @Override
    protected double normalize(double value, DoubleSummaryStatistics stats) {
        double total = stats.getSum();
        return total == 0 ? 0.0 : value / total;
    }
}
