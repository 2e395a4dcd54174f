package clean.engine.exec;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import clean.engine.schema.Schema;
import clean.engine.storage.CsvRowWriter;
import clean.engine.stream.CollectingConsumer;

/**
 * Writes one line per row. The file is released on close; the result is the
 * path of the written file.
 */
public class WriteConsumer extends CollectingConsumer {
    private static final Logger LOG = LoggerFactory.getLogger(WriteConsumer.class);

    private final CsvRowWriter writer;

    public WriteConsumer(Schema schema, CsvRowWriter writer) {
        super(schema);
        this.writer = writer;
    }

    @Override
    protected void collect(Object rowId, List<Object> row) {
        writer.write(row);
    }

    @Override
    protected Object result() {
        writer.close();
        LOG.info("Wrote {} row(s) to {}", writer.rowCount(), writer.file());
        return writer.file();
    }
}
