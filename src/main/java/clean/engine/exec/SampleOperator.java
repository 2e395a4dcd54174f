package clean.engine.exec;

import java.util.Random;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.ProducingOperator;

/**
 * Uniform random sample of n rows. A seed makes the sample reproducible.
 */
public class SampleOperator extends ProducingOperator {
    private final int size;
    private final Long seed; // nullable

    public SampleOperator(int size) {
        this(size, null);
    }

    public SampleOperator(int size, Long seed) {
        if (size < 0) throw new PipelineConfigurationException("Sample size must not be negative: " + size);
        this.size = size;
        this.seed = seed;
    }

    @Override
    protected ConsumerBinding prepare(DataSource upstream, Schema schema) {
        return (output, downstream) -> new SampleConsumer(output, downstream, size,
            seed != null ? new Random(seed) : new Random());
    }

    @Override
    public String toString() { return "Sample(" + size + (seed != null ? ", seed=" + seed : "") + ")"; }
}
