package clean.engine.function;

import static clean.engine.function.EvalFunctions.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import clean.engine.DataValueException;
import clean.engine.schema.ColumnRef;
import clean.engine.storage.Table;

public class EvalFunctionsTest {

    private static final Table DATA = Table.of(List.of("A", "B", "C"), List.of(List.of(1, "x", "y")));

    @Test
    void selectChoosesScalarOrTuple() {
        assertTrue(select(ColumnRef.names("A")) instanceof Col);
        assertTrue(select(ColumnRef.names("A", "B")) instanceof Cols);
        assertEquals(List.of("y", 1), select(List.of(ColumnRef.name("C"), ColumnRef.index(0)))
            .prepare(DATA).eval(List.of(1, "x", "y")));
    }

    @Test
    void unpreparedColumnCannotBeEvaluated() {
        Col c = col("B");
        assertThrows(IllegalStateException.class, () -> c.eval(List.of(1, "x", "y")));
        Col prepared = c.prepare(DATA);
        assertTrue(prepared.isPrepared());
        assertFalse(c.isPrepared());
        assertEquals("x", prepared.eval(List.of(1, "x", "y")));
        assertThrows(IllegalStateException.class, () -> new Cols(ColumnRef.names("A", "B")).eval(List.of(1, 2)));
    }

    @Test
    void emptinessTests() {
        EvalFunction empty = isEmpty(col("B")).prepare(DATA);
        assertEquals(true, empty.eval(Arrays.asList(1, null, "y")));
        assertEquals(true, empty.eval(Arrays.asList(1, "", "y")));
        assertEquals(false, empty.eval(Arrays.asList(1, " ", "y")));
        assertEquals(true, new IsEmpty(col("B"), true, false).prepare(DATA).eval(Arrays.asList(1, " ", "y")));
        EvalFunction notEmpty = isNotEmpty(cols("B", "C")).prepare(DATA);
        assertEquals(true, notEmpty.eval(Arrays.asList(1, "", "y")));
        assertEquals(false, notEmpty.eval(Arrays.asList(1, "", null)));
    }

    @Test
    void domainMembership() {
        assertEquals(true, isIn(col("B"), "x", "z").prepare(DATA).eval(List.of(1, "x", "y")));
        assertEquals(false, isNotIn(col("B"), "x", "z").prepare(DATA).eval(List.of(1, "x", "y")));
        assertEquals(true, new IsIn(col("B"), List.of("X"), true, false).prepare(DATA).eval(List.of(1, "x", "y")));
    }

    @Test
    void regexMatching() {
        assertEquals(true, matches(col("B"), "x").prepare(DATA).eval(List.of(1, "xyz", "y")));
        assertEquals(false, matches(col("B"), "x").fullMatch().prepare(DATA).eval(List.of(1, "xyz", "y")));
        assertEquals(true, matches(col("A"), "\\d+").fullMatch().prepare(DATA).eval(List.of(42, "", "")));
        assertEquals(false, matches(col("B"), ".*").prepare(DATA).eval(Arrays.asList(1, null, "")));
        assertEquals(true, matches(cols("B", "C"), "[a-z]").prepare(DATA).eval(List.of(1, "x", "y")));
        assertEquals(false, matches(cols("B", "C"), "[a-z]").prepare(DATA).eval(List.of(1, "x", "1")));
    }

    @Test
    void arithmetic() {
        assertEquals(3L, add(col("A"), 2).prepare(DATA).eval(List.of(1, "", "")));
        assertEquals(2.5, divide(col("A"), 2).prepare(DATA).eval(List.of(5, "", "")));
        assertEquals(1.5, multiply(col("A"), 0.5).prepare(DATA).eval(List.of(3, "", "")));
        assertNull(subtract(col("B"), 1).prepare(DATA).eval(List.of(1, "x", "")));
        assertNull(divide(col("A"), 0).prepare(DATA).eval(List.of(1, "", "")));
        Arithmetic raising = new Arithmetic(col("B"), Arithmetic.Op.ADD, constant(1), DataErrorPolicy.raise());
        assertThrows(DataValueException.class, () -> raising.prepare(DATA).eval(List.of(1, "x", "")));
    }

    @Test
    void lookupKeepsUnmappedValues() {
        EvalFunction f = lookup(col("B"), Map.of("x", "ex")).prepare(DATA);
        assertEquals("ex", f.eval(List.of(1, "x", "")));
        assertEquals("q", f.eval(List.of(1, "q", "")));
    }

    @Test
    void ifThenReplace() {
        IfThenReplace f = EvalFunctions.ifThenReplace(eq(col("A"), 1), "one");
        assertFalse(f.hasPassThrough());
        assertNull(f.prepare(DATA).eval(List.of(2, "x", "")));
        EvalFunction withElse = f.withPassThrough(col("B")).prepare(DATA);
        assertEquals("one", withElse.eval(List.of(1, "x", "")));
        assertEquals("x", withElse.eval(List.of(2, "x", "")));
    }

    @Test
    void constantIgnoresData() {
        Const c = constant("v");
        assertSame(c, c.prepare(DATA));
        assertEquals("v", c.eval(List.of()));
    }
}
