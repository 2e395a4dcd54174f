package clean.engine.function;

import java.util.List;

import clean.engine.stream.DataSource;

/**
 * Tests whether a value is empty: null, or an empty string. Optionally treats
 * whitespace-only strings as empty. For tuples, every element must be empty
 * (or, negated, at least one element must be non-empty).
 */
public final class IsEmpty implements EvalFunction {
    private final EvalFunction arg;
    private final boolean ignoreWhitespace;
    private final boolean negated;

    public IsEmpty(EvalFunction arg, boolean ignoreWhitespace, boolean negated) {
        if (arg == null) throw new IllegalArgumentException("arg must not be null");
        this.arg = arg;
        this.ignoreWhitespace = ignoreWhitespace;
        this.negated = negated;
    }

    public static IsEmpty isEmpty(EvalFunction arg) { return new IsEmpty(arg, false, false); }
    public static IsEmpty isNotEmpty(EvalFunction arg) { return new IsEmpty(arg, false, true); }

    @Override
    public IsEmpty prepare(DataSource data) {
        return new IsEmpty(arg.prepare(data), ignoreWhitespace, negated);
    }

    @Override
    public Object eval(List<Object> row) {
        Object value = arg.eval(row);
        boolean empty;
        if (value instanceof List<?> tuple) {
            empty = true;
            for (Object v : tuple) {
                if (!Values.isEmpty(v, ignoreWhitespace)) { empty = false; break; }
            }
        } else {
            empty = Values.isEmpty(value, ignoreWhitespace);
        }
        return empty != negated;
    }

    @Override
    public String toString() { return (negated ? "isNotEmpty(" : "isEmpty(") + arg + ")"; }
}
