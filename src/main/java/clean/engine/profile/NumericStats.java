package clean.engine.profile;

import java.util.Arrays;

/**
 * Running statistics over the numeric values of a column. Count, sum and
 * extremes are kept incrementally; the values themselves are retained for the
 * median and the variance. All statistics of an empty column are 0.
 */
public class NumericStats {
    private double[] values = new double[16];
    private int count;
    private double sum;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;

    public void add(double value) {
        if (count == values.length) values = Arrays.copyOf(values, count * 2);
        values[count++] = value;
        sum += value;
        if (value < min) min = value;
        if (value > max) max = value;
    }

    public int count() { return count; }
    public double sum() { return sum; }
    public double min() { return count == 0 ? 0.0 : min; }
    public double max() { return count == 0 ? 0.0 : max; }

    public double mean() {
        return count == 0 ? 0.0 : sum / count;
    }

    /** Sample variance with an n-1 denominator; 0 for fewer than two values. */
    public double variance() {
        if (count < 2) return 0.0;
        double m = mean();
        double squares = 0.0;
        for (int i = 0; i < count; i++) squares += (values[i] - m) * (values[i] - m);
        return squares / (count - 1);
    }

    public double stddev() {
        return Math.sqrt(variance());
    }

    public double median() {
        if (count == 0) return 0.0;
        double[] sorted = Arrays.copyOf(values, count);
        Arrays.sort(sorted);
        int mid = count / 2;
        return count % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2;
    }

    @Override
    public String toString() {
        return "NumericStats(count=" + count + ", min=" + min() + ", max=" + max() + ", mean=" + mean() + ")";
    }
}
