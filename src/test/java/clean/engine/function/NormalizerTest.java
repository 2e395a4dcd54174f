package clean.engine.function;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import clean.engine.DataValueException;
import clean.engine.storage.Table;

public class NormalizerTest {

    private static Table values(Object... v) {
        List<List<Object>> rows = new ArrayList<>();
        for (Object o : v) rows.add(Arrays.asList(o));
        return Table.of(List.of("X"), rows);
    }

    @Test
    void minMaxScaleUsesColumnRange() {
        EvalFunction f = new MinMaxScale(EvalFunctions.col("X")).prepare(values(10, 20, 30));
        assertEquals(0.0, f.eval(List.of(10)));
        assertEquals(0.5, f.eval(List.of(20)));
        assertEquals(1.0, f.eval(List.of(30)));
    }

    @Test
    void repreparationReflectsOnlyLatestData() {
        MinMaxScale unprepared = new MinMaxScale(EvalFunctions.col("X"));
        EvalFunction first = unprepared.prepare(values(0, 10));
        EvalFunction second = unprepared.prepare(values(0, 100));
        assertEquals(0.5, first.eval(List.of(5)));
        assertEquals(0.05, (Double) second.eval(List.of(5)), 1e-9);
        // preparing again from an already prepared function also starts over
        EvalFunction third = ((MinMaxScale) second).prepare(values(0, 20));
        assertEquals(0.25, third.eval(List.of(5)));
    }

    @Test
    void unpreparedEvaluationIsProgrammerError() {
        MinMaxScale f = new MinMaxScale(EvalFunctions.col("X"));
        assertFalse(f.isPrepared());
        assertThrows(IllegalStateException.class, () -> f.eval(List.of(1)));
    }

    @Test
    void constantColumnScalesToZero() {
        EvalFunction f = new MinMaxScale(EvalFunctions.col("X")).prepare(values(4, 4, 4));
        assertEquals(0.0, f.eval(List.of(4)));
    }

    @Test
    void nonNumericValuesFollowErrorPolicy() {
        Table data = values(1, "n/a", 3);
        EvalFunction raising = new MinMaxScale(EvalFunctions.col("X")).prepare(data);
        DataValueException e = assertThrows(DataValueException.class, () -> raising.eval(List.of("n/a")));
        assertEquals("n/a", e.value());

        EvalFunction passing = new MinMaxScale(EvalFunctions.col("X"), DataErrorPolicy.passThrough()).prepare(data);
        assertEquals("n/a", passing.eval(List.of("n/a")));

        EvalFunction defaulting = new MinMaxScale(EvalFunctions.col("X"), DataErrorPolicy.useDefault(-1)).prepare(data);
        assertEquals(-1, defaulting.eval(Arrays.asList((Object) null)));
    }

    @Test
    void maxAbsScaleAndDivideByTotal() {
        Table data = values(-4, 2, 2);
        assertEquals(-1.0, new MaxAbsScale(EvalFunctions.col("X")).prepare(data).eval(List.of(-4)));
        assertEquals(0.5, new MaxAbsScale(EvalFunctions.col("X")).prepare(data).eval(List.of(2)));
        Table positive = values(1, 3, 4);
        assertEquals(0.375, new DivideByTotal(EvalFunctions.col("X")).prepare(positive).eval(List.of(3)));
    }
}
