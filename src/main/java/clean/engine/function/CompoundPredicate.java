package clean.engine.function;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

import clean.engine.PipelineConfigurationException;
import clean.engine.stream.DataSource;

/**
 * Logical conjunction, disjunction or negation of predicates. A predicate
 * holds when it evaluates to {@code Boolean.TRUE}; any other result, null
 * included, counts as false. AND and OR stop at the first child that decides
 * the outcome.
 */
public final class CompoundPredicate implements EvalFunction {
    public enum Type { AND, OR, NOT }

    private final Type type;
    private final List<EvalFunction> operands;

    private CompoundPredicate(Type type, List<EvalFunction> operands) {
        int n = operands.size();
        if (type == Type.NOT ? n != 1 : n < 2) {
            throw new PipelineConfigurationException(type + " cannot combine " + n + " predicate(s)");
        }
        this.type = type;
        this.operands = List.copyOf(operands);
    }

    public static CompoundPredicate and(EvalFunction... predicates) {
        return new CompoundPredicate(Type.AND, Arrays.asList(predicates));
    }

    public static CompoundPredicate or(EvalFunction... predicates) {
        return new CompoundPredicate(Type.OR, Arrays.asList(predicates));
    }

    public static CompoundPredicate not(EvalFunction predicate) {
        return new CompoundPredicate(Type.NOT, List.of(predicate));
    }

    public Type type() { return type; }
    public List<EvalFunction> operands() { return operands; }

    @Override
    public CompoundPredicate prepare(DataSource data) {
        List<EvalFunction> prepared = new ArrayList<>(operands.size());
        for (EvalFunction f : operands) prepared.add(f.prepare(data));
        return new CompoundPredicate(type, prepared);
    }

    @Override
    public Object eval(List<Object> row) {
        if (type == Type.NOT) return !Values.isTrue(operands.get(0).eval(row));
        // AND stops on the first false operand, OR on the first true one
        boolean decisive = type == Type.OR;
        for (EvalFunction p : operands) {
            if (Values.isTrue(p.eval(row)) == decisive) return decisive;
        }
        return !decisive;
    }

    @Override
    public String toString() {
        if (type == Type.NOT) return "NOT(" + operands.get(0) + ")";
        StringJoiner joined = new StringJoiner(" " + type + " ", "(", ")");
        for (EvalFunction p : operands) joined.add(String.valueOf(p));
        return joined.toString();
    }
}
