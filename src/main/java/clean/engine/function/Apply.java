package clean.engine.function;

import java.util.List;
import java.util.function.Function;

import clean.engine.stream.DataSource;

/**
 * Applies a plain Java function to the value of another expression.
 */
public final class Apply implements EvalFunction {
    private final EvalFunction arg;
    private final Function<Object, Object> fn;
    private final String name;

    public Apply(EvalFunction arg, Function<Object, Object> fn) {
        this(arg, fn, "apply");
    }

    public Apply(EvalFunction arg, Function<Object, Object> fn, String name) {
        if (arg == null || fn == null) throw new IllegalArgumentException("Apply needs an argument and a function");
        this.arg = arg;
        this.fn = fn;
        this.name = name;
    }

    @Override
    public Apply prepare(DataSource data) {
        return new Apply(arg.prepare(data), fn, name);
    }

    @Override
    public Object eval(List<Object> row) {
        return fn.apply(arg.eval(row));
    }

    @Override
    public String toString() { return name + "(" + arg + ")"; }
}
