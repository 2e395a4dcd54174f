package clean.engine.function;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import clean.engine.stream.DataSource;

/**
 * Domain membership test. Tuple values are looked up as lists, so a domain for
 * a multi-column argument holds lists of values.
 */
public final class IsIn implements EvalFunction {
    private final EvalFunction arg;
    private final Set<Object> domain;
    private final boolean ignoreCase;
    private final boolean negated;

    public IsIn(EvalFunction arg, Collection<?> domain, boolean ignoreCase, boolean negated) {
        if (arg == null) throw new IllegalArgumentException("arg must not be null");
        if (domain == null) throw new IllegalArgumentException("domain must not be null");
        this.arg = arg;
        this.ignoreCase = ignoreCase;
        this.negated = negated;
        Set<Object> d = new HashSet<>();
        for (Object v : domain) d.add(ignoreCase ? Values.lowerCase(v) : v);
        this.domain = d;
    }

    private IsIn(IsIn template, EvalFunction arg) {
        this.arg = arg;
        this.domain = template.domain;
        this.ignoreCase = template.ignoreCase;
        this.negated = template.negated;
    }

    @Override
    public IsIn prepare(DataSource data) {
        return new IsIn(this, arg.prepare(data));
    }

    @Override
    public Object eval(List<Object> row) {
        Object value = arg.eval(row);
        if (ignoreCase) value = Values.lowerCase(value);
        return domain.contains(value) != negated;
    }

    @Override
    public String toString() { return arg + (negated ? " not in " : " in ") + domain; }
}
