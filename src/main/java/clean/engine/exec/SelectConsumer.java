package clean.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import clean.engine.schema.Schema;
import clean.engine.stream.ProducingConsumer;
import clean.engine.stream.StreamConsumer;

/**
 * Builds rows from fixed positions of the input row. Positions are resolved
 * once when the stage is opened and not re-validated per row.
 */
public class SelectConsumer extends ProducingConsumer {
    private final int[] positions;

    public SelectConsumer(Schema schema, StreamConsumer downstream, int[] positions) {
        super(schema, downstream);
        this.positions = positions.clone();
    }

    @Override
    protected List<Object> handle(Object rowId, List<Object> row) {
        List<Object> projected = new ArrayList<>(positions.length);
        for (int idx : positions) {
            projected.add(row.get(idx));
        }
        return Collections.unmodifiableList(projected);
    }
}
