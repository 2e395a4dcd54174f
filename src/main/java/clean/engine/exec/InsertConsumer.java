package clean.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import clean.engine.function.EvalFunction;
import clean.engine.schema.Schema;
import clean.engine.stream.ProducingConsumer;
import clean.engine.stream.StreamConsumer;

/** Adds the function values to each row at a fixed position. */
public class InsertConsumer extends ProducingConsumer {
    private final int position;
    private final int count;
    private final EvalFunction values;

    public InsertConsumer(Schema schema, StreamConsumer downstream, int position, int count, EvalFunction values) {
        super(schema, downstream);
        this.position = position;
        this.count = count;
        this.values = values;
    }

    @Override
    protected List<Object> handle(Object rowId, List<Object> row) {
        List<?> inserted = Tuples.spread(values.eval(row), count, values);
        List<Object> out = new ArrayList<>(row.size() + count);
        out.addAll(row);
        out.addAll(position, inserted);
        return Collections.unmodifiableList(out);
    }
}
