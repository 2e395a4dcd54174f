package clean.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.Schema;
import clean.engine.stream.Row;

public class TableTest {

    @Test
    void ofAssignsSequentialRowIds() {
        Table t = Table.of(List.of("A"), List.of(List.of("x"), List.of("y")));
        assertEquals(List.of(0L, 1L), t.rowIds());
        assertEquals(List.of("x", "y"), t.column("A"));
    }

    @Test
    void subsetFollowsIdOrder() {
        Table t = new Table(Schema.of("A"), List.of(Row.of("r1", 1), Row.of("r2", 2), Row.of("r3", 3)));
        assertEquals(List.of(3, 1), t.subset(List.of("r3", "r1")).column("A"));
        assertThrows(IllegalArgumentException.class, () -> t.subset(List.of("r9")));
    }

    @Test
    void subsetRejectsSharedRowIds() {
        Table t = new Table(Schema.of("A"), List.of(Row.of("r1", 1), Row.of("r1", 2), Row.of("r2", 3)));
        assertThrows(PipelineConfigurationException.class, () -> t.subset(List.of("r1")));
        assertEquals(List.of(3), t.subset(List.of("r2")).column("A"));
    }

    @Test
    void rowWidthMustMatchSchema() {
        assertThrows(PipelineConfigurationException.class,
            () -> new Table(Schema.of("A", "B"), List.of(Row.of(0L, 1))));
    }

    @Test
    void rowsAreImmutable() {
        Table t = Table.of(List.of("A"), List.of(List.of(1)));
        assertThrows(UnsupportedOperationException.class, () -> t.row(0).values().set(0, 2));
    }
}
