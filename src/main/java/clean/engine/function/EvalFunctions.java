package clean.engine.function;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import clean.engine.schema.ColumnRef;

/**
 * Static builders for evaluation functions.
 */
public final class EvalFunctions {
    private EvalFunctions() {}

    public static Col col(String name) { return new Col(ColumnRef.name(name)); }
    public static Col col(int index) { return new Col(ColumnRef.index(index)); }

    public static EvalFunction cols(String... names) { return select(ColumnRef.names(names)); }

    /**
     * Value of one column, or the tuple of values for several columns.
     */
    public static EvalFunction select(List<ColumnRef> columns) {
        if (columns == null || columns.isEmpty()) throw new IllegalArgumentException("columns must be non-empty");
        if (columns.size() == 1) return new Col(columns.get(0));
        return new Cols(columns);
    }

    public static Const constant(Object value) { return new Const(value); }

    /** Wrap a plain value as a constant; functions are returned as they are. */
    public static EvalFunction valueOf(Object value) {
        return value instanceof EvalFunction f ? f : new Const(value);
    }

    public static Compare eq(EvalFunction lhs, Object rhs) { return new Compare(lhs, Compare.Op.EQ, valueOf(rhs)); }
    public static Compare neq(EvalFunction lhs, Object rhs) { return new Compare(lhs, Compare.Op.NEQ, valueOf(rhs)); }
    public static Compare lt(EvalFunction lhs, Object rhs) { return new Compare(lhs, Compare.Op.LT, valueOf(rhs)); }
    public static Compare lte(EvalFunction lhs, Object rhs) { return new Compare(lhs, Compare.Op.LTE, valueOf(rhs)); }
    public static Compare gt(EvalFunction lhs, Object rhs) { return new Compare(lhs, Compare.Op.GT, valueOf(rhs)); }
    public static Compare gte(EvalFunction lhs, Object rhs) { return new Compare(lhs, Compare.Op.GTE, valueOf(rhs)); }

    public static Arithmetic add(EvalFunction lhs, Object rhs) { return new Arithmetic(lhs, Arithmetic.Op.ADD, valueOf(rhs)); }
    public static Arithmetic subtract(EvalFunction lhs, Object rhs) { return new Arithmetic(lhs, Arithmetic.Op.SUBTRACT, valueOf(rhs)); }
    public static Arithmetic multiply(EvalFunction lhs, Object rhs) { return new Arithmetic(lhs, Arithmetic.Op.MULTIPLY, valueOf(rhs)); }
    public static Arithmetic divide(EvalFunction lhs, Object rhs) { return new Arithmetic(lhs, Arithmetic.Op.DIVIDE, valueOf(rhs)); }

    public static CompoundPredicate and(EvalFunction... predicates) { return CompoundPredicate.and(predicates); }
    public static CompoundPredicate or(EvalFunction... predicates) { return CompoundPredicate.or(predicates); }
    public static CompoundPredicate not(EvalFunction predicate) { return CompoundPredicate.not(predicate); }

    public static IsEmpty isEmpty(EvalFunction arg) { return IsEmpty.isEmpty(arg); }
    public static IsEmpty isNotEmpty(EvalFunction arg) { return IsEmpty.isNotEmpty(arg); }

    public static IsIn isIn(EvalFunction arg, Object... domain) { return new IsIn(arg, Arrays.asList(domain), false, false); }
    public static IsIn isNotIn(EvalFunction arg, Object... domain) { return new IsIn(arg, Arrays.asList(domain), false, true); }

    public static IsMatch matches(EvalFunction arg, String regex) { return new IsMatch(arg, regex); }

    /** Replace values through a mapping; values without an entry are kept. */
    public static Apply lookup(EvalFunction arg, Map<?, ?> mapping) {
        Map<Object, Object> copy = new HashMap<>(mapping);
        return new Apply(arg, v -> copy.containsKey(v) ? copy.get(v) : v, "lookup");
    }

    public static IfThenReplace ifThenReplace(EvalFunction predicate, Object value) {
        return new IfThenReplace(predicate, valueOf(value));
    }

    public static MinMaxScale minMaxScale(EvalFunction arg) { return new MinMaxScale(arg); }
    public static MaxAbsScale maxAbsScale(EvalFunction arg) { return new MaxAbsScale(arg); }
    public static DivideByTotal divideByTotal(EvalFunction arg) { return new DivideByTotal(arg); }
}
