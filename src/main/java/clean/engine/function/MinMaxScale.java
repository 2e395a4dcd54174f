package clean.engine.function;

import java.util.DoubleSummaryStatistics;

/**
 * Scales values to [0, 1] using the column minimum and maximum.
 * A constant column scales to 0.
 */
public final class MinMaxScale extends Normalizer {

    public MinMaxScale(EvalFunction arg) {
        this(arg, DataErrorPolicy.raise());
    }

    public MinMaxScale(EvalFunction arg, DataErrorPolicy onError) {
        super(arg, onError, null);
    }

    private MinMaxScale(EvalFunction arg, DataErrorPolicy onError, DoubleSummaryStatistics stats) {
        super(arg, onError, stats);
    }

    @Override
    protected Normalizer withStatistics(EvalFunction arg, DoubleSummaryStatistics stats) {
        return new MinMaxScale(arg, onError, stats);
    }

    @Override
    protected double normalize(double value, DoubleSummaryStatistics stats) {
        double range = stats.getMax() - stats.getMin();
        if (stats.getCount() == 0 || range == 0) return 0.0;
        return (value - stats.getMin()) / range;
    }
}
