package clean.engine.function;

import java.util.List;

import clean.engine.stream.DataSource;

/**
 * A unit of computation over a data row.
 * <p>
 * Functions go through two phases. {@link #prepare} is called once per
 * pipeline run, before any row is evaluated, with the rows arriving at the
 * stage that uses the function. It returns a prepared function and never
 * modifies the receiver, so one unprepared function can be shared by any
 * number of pipelines. Functions that only need column positions read the
 * schema; functions that need dataset statistics scan the rows. Functions
 * without either requirement return themselves.
 * <p>
 * {@link #eval} returns a single value, or an unmodifiable list of values for
 * functions that produce a tuple. Calling it on a function that requires
 * preparation but was not prepared is a programming error and fails with
 * {@link IllegalStateException}.
 */
public interface EvalFunction {

    EvalFunction prepare(DataSource data);

    Object eval(List<Object> row);
}
