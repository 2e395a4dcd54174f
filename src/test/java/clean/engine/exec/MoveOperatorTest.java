package clean.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.ColumnRef;
import clean.engine.schema.Schema;
import clean.engine.storage.Table;
import clean.engine.stream.DataStream;

public class MoveOperatorTest {

    @Test
    void movesColumnsToPosition() {
        Schema in = Schema.of("A", "B", "C", "D");
        assertEquals(Schema.of("C", "A", "B", "D"), new MoveOperator(ColumnRef.names("C"), 0).outputSchema(in));
        assertEquals(Schema.of("B", "C", "A", "D"), new MoveOperator(ColumnRef.names("A"), 2).outputSchema(in));
        assertEquals(Schema.of("B", "C", "D", "A"), new MoveOperator(ColumnRef.names("A"), 3).outputSchema(in));
        assertEquals(Schema.of("A", "D", "B", "C"), new MoveOperator(ColumnRef.names("D"), 1).outputSchema(in));
    }

    @Test
    void movesValuesWithTheirColumns() {
        Table table = Table.of(List.of("A", "B", "C"), List.of(List.of(1, 2, 3)));
        Table out = (Table) new DataStream(table)
            .append(new MoveOperator(ColumnRef.names("C", "A"), 0))
            .append(new TableOperator())
            .run();
        assertEquals(Schema.of("C", "A", "B"), out.schema());
        assertEquals(List.of(3, 1, 2), out.row(0).values());
    }

    @Test
    void positionOutOfRange() {
        MoveOperator op = new MoveOperator(ColumnRef.names("A"), 5);
        assertThrows(PipelineConfigurationException.class, () -> op.outputSchema(Schema.of("A", "B")));
    }
}
