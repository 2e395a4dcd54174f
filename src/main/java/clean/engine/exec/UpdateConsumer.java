package clean.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import clean.engine.function.EvalFunction;
import clean.engine.schema.Schema;
import clean.engine.stream.ProducingConsumer;
import clean.engine.stream.StreamConsumer;

/** Writes the function result into fixed positions of a copy of each row. */
public class UpdateConsumer extends ProducingConsumer {
    private final int[] positions;
    private final EvalFunction fn;

    public UpdateConsumer(Schema schema, StreamConsumer downstream, int[] positions, EvalFunction fn) {
        super(schema, downstream);
        this.positions = positions.clone();
        this.fn = fn;
    }

    @Override
    protected List<Object> handle(Object rowId, List<Object> row) {
        List<?> values = Tuples.spread(fn.eval(row), positions.length, fn);
        List<Object> out = new ArrayList<>(row);
        for (int i = 0; i < positions.length; i++) out.set(positions[i], values.get(i));
        return Collections.unmodifiableList(out);
    }
}
