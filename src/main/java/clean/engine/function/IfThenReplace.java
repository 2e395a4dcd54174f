package clean.engine.function;

import java.util.List;

import clean.engine.stream.DataSource;

/**
 * Conditional replacement: where the predicate holds the replacement value is
 * returned, otherwise the pass-through value. Without a pass-through
 * expression, rows that do not match evaluate to null; update operations add
 * the updated columns as pass-through before preparing.
 */
public final class IfThenReplace implements EvalFunction {
    private final EvalFunction predicate;
    private final EvalFunction value;
    private final EvalFunction passThrough; // nullable

    public IfThenReplace(EvalFunction predicate, EvalFunction value) {
        this(predicate, value, null);
    }

    public IfThenReplace(EvalFunction predicate, EvalFunction value, EvalFunction passThrough) {
        if (predicate == null || value == null) throw new IllegalArgumentException("IfThenReplace needs a predicate and a value");
        this.predicate = predicate;
        this.value = value;
        this.passThrough = passThrough;
    }

    public boolean hasPassThrough() { return passThrough != null; }

    public IfThenReplace withPassThrough(EvalFunction passThrough) {
        return new IfThenReplace(predicate, value, passThrough);
    }

    @Override
    public IfThenReplace prepare(DataSource data) {
        EvalFunction p = predicate.prepare(data);
        EvalFunction v = value.prepare(data);
        EvalFunction t = passThrough != null ? passThrough.prepare(data) : null;
        return new IfThenReplace(p, v, t);
    }

    @Override
    public Object eval(List<Object> row) {
        if (Values.isTrue(predicate.eval(row))) return value.eval(row);
        return passThrough != null ? passThrough.eval(row) : null;
    }

    @Override
    public String toString() {
        return "if " + predicate + " then " + value + (passThrough != null ? " else " + passThrough : "");
    }
}
