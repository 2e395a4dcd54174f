package clean.engine.function;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import clean.engine.stream.DataSource;

/**
 * Regular expression match. Non-string values are matched on their string
 * form; null never matches. By default the pattern only has to match at the
 * start of the value; full matching is optional. For tuples, {@code forAll}
 * decides whether every element or any element has to match.
 */
public final class IsMatch implements EvalFunction {
    private final EvalFunction arg;
    private final Pattern pattern;
    private final boolean fullMatch;
    private final boolean forAll;
    private final boolean negated;

    public IsMatch(EvalFunction arg, String regex) {
        this(arg, Pattern.compile(regex), false, true, false);
    }

    public IsMatch(EvalFunction arg, Pattern pattern, boolean fullMatch, boolean forAll, boolean negated) {
        if (arg == null || pattern == null) throw new IllegalArgumentException("IsMatch needs an argument and a pattern");
        this.arg = arg;
        this.pattern = pattern;
        this.fullMatch = fullMatch;
        this.forAll = forAll;
        this.negated = negated;
    }

    public IsMatch fullMatch() { return new IsMatch(arg, pattern, true, forAll, negated); }
    public IsMatch negate() { return new IsMatch(arg, pattern, fullMatch, forAll, !negated); }

    @Override
    public IsMatch prepare(DataSource data) {
        return new IsMatch(arg.prepare(data), pattern, fullMatch, forAll, negated);
    }

    @Override
    public Object eval(List<Object> row) {
        Object value = arg.eval(row);
        boolean result;
        if (value instanceof List<?> tuple) {
            result = forAll;
            for (Object v : tuple) {
                if (matches(v) != forAll) { result = !forAll; break; }
            }
        } else {
            result = matches(value);
        }
        return result != negated;
    }

    private boolean matches(Object value) {
        if (value == null) return false;
        Matcher m = pattern.matcher(value.toString());
        return fullMatch ? m.matches() : m.lookingAt();
    }

    @Override
    public String toString() { return arg + (negated ? " !~ " : " ~ ") + pattern.pattern(); }
}
