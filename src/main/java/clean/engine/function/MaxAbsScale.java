package clean.engine.function;

import java.util.DoubleSummaryStatistics;

/** Divides values by the largest absolute value in the column. */
public final class MaxAbsScale extends Normalizer {

    public MaxAbsScale(EvalFunction arg) {
        this(arg, DataErrorPolicy.raise());
    }

    public MaxAbsScale(EvalFunction arg, DataErrorPolicy onError) {
        super(arg, onError, null);
    }

    private MaxAbsScale(EvalFunction arg, DataErrorPolicy onError, DoubleSummaryStatistics stats) {
        super(arg, onError, stats);
    }

    @Override
    protected Normalizer withStatistics(EvalFunction arg, DoubleSummaryStatistics stats) {
        return new MaxAbsScale(arg, onError, stats);
    }

    @Override
    protected double normalize(double value, DoubleSummaryStatistics stats) {
        if (stats.getCount() == 0) return 0.0;
        double maxAbs = Math.max(Math.abs(stats.getMin()), Math.abs(stats.getMax()));
        return maxAbs == 0 ? 0.0 : value / maxAbs;
    }
}
