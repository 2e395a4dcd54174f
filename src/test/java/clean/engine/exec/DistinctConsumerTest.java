package clean.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import clean.engine.schema.ColumnRef;
import clean.engine.storage.Table;
import clean.engine.stream.DataStream;

public class DistinctConsumerTest {

    private static Table rows() {
        return Table.of(List.of("A", "B", "C"), List.of(
            List.of(1, 2, 3),
            List.of(3, 4, 5),
            List.of(1, 2, 3),
            List.of(3, 4, 5),
            List.of(1, 2, 3)));
    }

    @Test
    void multiColumnKeysAreTuples() {
        @SuppressWarnings("unchecked")
        Map<Object, Long> counts = (Map<Object, Long>) new DataStream(rows())
            .append(new DistinctOperator())
            .run();
        assertEquals(2, counts.size());
        assertEquals(3L, counts.get(List.of(1, 2, 3)));
        assertEquals(2L, counts.get(List.of(3, 4, 5)));
    }

    @Test
    void singleColumnKeysAreScalars() {
        @SuppressWarnings("unchecked")
        Map<Object, Long> counts = (Map<Object, Long>) new DataStream(rows())
            .append(new DistinctOperator(ColumnRef.names("C")))
            .run();
        assertEquals(Map.of(3, 3L, 5, 2L), counts);
    }
}
