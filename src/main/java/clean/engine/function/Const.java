package clean.engine.function;

import java.util.List;

import clean.engine.stream.DataSource;

/** Constant value, whatever the row. */
public final class Const implements EvalFunction {
    private final Object value;

    public Const(Object value) { this.value = value; }

    public Object value() { return value; }

    @Override
    public Const prepare(DataSource data) { return this; }

    @Override
    public Object eval(List<Object> row) { return value; }

    @Override
    public String toString() { return String.valueOf(value); }
}
