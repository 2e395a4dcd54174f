package clean.engine.function;

import java.util.List;

import clean.engine.stream.DataSource;

/**
 * Comparison between two expressions.
 * Supports operators: EQ, NEQ, LT, LTE, GT, GTE.
 * Numbers compare by value regardless of their class. Values that cannot be
 * ordered are handed to the error policy, which yields false by default.
 */
public final class Compare implements EvalFunction {
    public enum Op { EQ, NEQ, LT, LTE, GT, GTE }

    private final EvalFunction lhs;
    private final Op op;
    private final EvalFunction rhs;
    private final boolean ignoreCase;
    private final DataErrorPolicy onError;

    public Compare(EvalFunction lhs, Op op, EvalFunction rhs) {
        this(lhs, op, rhs, false, DataErrorPolicy.useDefault(Boolean.FALSE));
    }

    public Compare(EvalFunction lhs, Op op, EvalFunction rhs, boolean ignoreCase, DataErrorPolicy onError) {
        if (lhs == null || rhs == null || op == null) throw new IllegalArgumentException("Comparison needs two operands and an operator");
        this.lhs = lhs;
        this.op = op;
        this.rhs = rhs;
        this.ignoreCase = ignoreCase;
        this.onError = onError;
    }

    /** Same comparison with case-insensitive string matching. */
    public Compare ignoringCase() {
        return new Compare(lhs, op, rhs, true, onError);
    }

    public Compare onError(DataErrorPolicy policy) {
        return new Compare(lhs, op, rhs, ignoreCase, policy);
    }

    @Override
    public Compare prepare(DataSource data) {
        EvalFunction l = lhs.prepare(data);
        EvalFunction r = rhs.prepare(data);
        return new Compare(l, op, r, ignoreCase, onError);
    }

    @Override
    public Object eval(List<Object> row) {
        Object a = lhs.eval(row);
        Object b = rhs.eval(row);
        if (ignoreCase) {
            a = Values.lowerCase(a);
            b = Values.lowerCase(b);
        }
        if (op == Op.EQ) return Values.same(a, b);
        if (op == Op.NEQ) return !Values.same(a, b);
        int c;
        try {
            c = Values.compare(a, b);
        } catch (ClassCastException e) {
            return onError.handle(a, "Cannot evaluate " + a + " " + op + " " + b + ": " + e.getMessage());
        }
        return switch (op) {
            case LT -> c < 0;
            case LTE -> c <= 0;
            case GT -> c > 0;
            case GTE -> c >= 0;
            default -> throw new IllegalStateException("Unexpected operator: " + op);
        };
    }

    @Override
    public String toString() { return lhs + " " + op + " " + rhs; }
}
