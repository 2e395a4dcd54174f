package clean.engine.function;

import java.util.List;

import clean.engine.stream.DataSource;

/**
 * Arithmetic over two numeric expressions. Integral operands keep integral
 * results (as long) except for division; everything else is computed on
 * doubles. Non-numeric operands and division by zero go to the error policy,
 * which yields null by default.
 */
public final class Arithmetic implements EvalFunction {
    public enum Op { ADD, SUBTRACT, MULTIPLY, DIVIDE, FLOOR_DIVIDE }

    private final EvalFunction lhs;
    private final Op op;
    private final EvalFunction rhs;
    private final DataErrorPolicy onError;

    public Arithmetic(EvalFunction lhs, Op op, EvalFunction rhs) {
        this(lhs, op, rhs, DataErrorPolicy.useDefault(null));
    }

    public Arithmetic(EvalFunction lhs, Op op, EvalFunction rhs, DataErrorPolicy onError) {
        if (lhs == null || rhs == null || op == null) throw new IllegalArgumentException("Arithmetic needs two operands and an operator");
        this.lhs = lhs;
        this.op = op;
        this.rhs = rhs;
        this.onError = onError;
    }

    @Override
    public Arithmetic prepare(DataSource data) {
        EvalFunction l = lhs.prepare(data);
        EvalFunction r = rhs.prepare(data);
        return new Arithmetic(l, op, r, onError);
    }

    @Override
    public Object eval(List<Object> row) {
        Object a = lhs.eval(row);
        Object b = rhs.eval(row);
        if (!Values.isNumeric(a) || !Values.isNumeric(b)) {
            return onError.handle(a, "Non-numeric operand for " + op + ": " + a + ", " + b);
        }
        boolean integral = isIntegral(a) && isIntegral(b);
        if ((op == Op.DIVIDE || op == Op.FLOOR_DIVIDE) && Values.toDouble(b) == 0) {
            return onError.handle(a, "Division by zero");
        }
        if (integral && op != Op.DIVIDE) {
            long x = ((Number) a).longValue();
            long y = ((Number) b).longValue();
            return switch (op) {
                case ADD -> x + y;
                case SUBTRACT -> x - y;
                case MULTIPLY -> x * y;
                case FLOOR_DIVIDE -> Math.floorDiv(x, y);
                default -> throw new IllegalStateException("Unexpected operator: " + op);
            };
        }
        double x = Values.toDouble(a);
        double y = Values.toDouble(b);
        return switch (op) {
            case ADD -> x + y;
            case SUBTRACT -> x - y;
            case MULTIPLY -> x * y;
            case DIVIDE -> x / y;
            case FLOOR_DIVIDE -> Math.floor(x / y);
        };
    }

    private static boolean isIntegral(Object v) {
        return v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte;
    }

    @Override
    public String toString() { return "(" + lhs + " " + op + " " + rhs + ")"; }
}
