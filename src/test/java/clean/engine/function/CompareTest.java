package clean.engine.function;

import static clean.engine.function.EvalFunctions.*;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import clean.engine.DataValueException;
import clean.engine.storage.Table;

public class CompareTest {

    private static final Table DATA = Table.of(List.of("A", "B"), List.of(List.of(1, "x")));

    private static Object eval(EvalFunction f, Object... row) {
        return f.prepare(DATA).eval(Arrays.asList(row));
    }

    @Test
    void nonFiniteDoublesAgainstDecimals() {
        BigDecimal one = new BigDecimal("1");
        assertEquals(false, eval(eq(col("A"), one), Double.NaN, "x"));
        assertEquals(true, eval(neq(col("A"), one), Double.NaN, "x"));
        assertEquals(true, eval(gt(col("A"), one), Double.POSITIVE_INFINITY, "x"));
        assertEquals(true, eval(lt(col("A"), one), Double.NEGATIVE_INFINITY, "x"));
    }

    @Test
    void numbersCompareByValue() {
        assertEquals(true, eval(eq(col("A"), 2L), 2, "x"));
        assertEquals(true, eval(lt(col("A"), 2.5), 2, "x"));
        assertEquals(true, eval(gte(col("A"), new BigDecimal("2.0")), 2, "x"));
        assertEquals(false, eval(neq(col("A"), 2.0), 2, "x"));
    }

    @Test
    void stringsCompareLexically() {
        assertEquals(true, eval(lt(col("B"), "y"), 1, "x"));
        assertEquals(false, eval(eq(col("B"), "X"), 1, "x"));
        assertEquals(true, eval(eq(col("B"), "X").ignoringCase(), 1, "x"));
    }

    @Test
    void incomparableValuesDefaultToFalse() {
        assertEquals(false, eval(gt(col("B"), 1), 1, "x"));
        assertEquals(false, eval(gt(col("A"), 1), null, "x"));
        Compare raising = gt(col("B"), 1).onError(DataErrorPolicy.raise());
        assertThrows(DataValueException.class, () -> eval(raising, 1, "x"));
    }

    @Test
    void nullEquality() {
        assertEquals(true, eval(eq(col("A"), null), null, "x"));
        assertEquals(false, eval(eq(col("A"), null), 1, "x"));
    }

    @Test
    void tuplesCompareElementWise() {
        EvalFunction both = cols("A", "B");
        assertEquals(true, eval(eq(both, List.of(1, "x")), 1, "x"));
        assertEquals(true, eval(lt(both, List.of(1, "y")), 1, "x"));
    }
}
