package clean.engine.exec;

import java.util.Collections;
import java.util.List;

import clean.engine.PipelineConfigurationException;
import clean.engine.function.EvalFunction;

/**
 * Helpers for stages that write function results into several columns.
 */
final class Tuples {
    private Tuples() {}

    /**
     * The function result as one value per target column. A single target
     * takes the result as it is; several targets need a tuple of matching size.
     */
    static List<?> spread(Object result, int targets, EvalFunction fn) {
        if (targets == 1) return Collections.singletonList(result);
        if (!(result instanceof List<?> tuple) || tuple.size() != targets) {
            throw new PipelineConfigurationException("Function " + fn + " must return " + targets
                + " values, got " + result);
        }
        return tuple;
    }
}
