package clean.engine.exec;

import java.nio.file.Path;

import clean.engine.schema.Schema;
import clean.engine.storage.CsvOptions;
import clean.engine.storage.CsvRowWriter;
import clean.engine.stream.CollectingOperator;
import clean.engine.stream.StreamConsumer;

/**
 * Writes the pipeline output to a delimited text file. The file is created
 * and the header written when the stage is opened.
 */
public class WriteOperator extends CollectingOperator {
    private final Path file;
    private final CsvOptions options;

    public WriteOperator(Path file) {
        this(file, CsvOptions.forFile(file));
    }

    public WriteOperator(Path file, CsvOptions options) {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        this.file = file;
        this.options = options != null ? options : CsvOptions.forFile(file);
    }

    @Override
    protected StreamConsumer createConsumer(Schema schema) {
        CsvRowWriter writer = new CsvRowWriter(file, options);
        try {
            writer.writeHeader(schema);
        } catch (RuntimeException e) {
            writer.close();
            throw e;
        }
        return new WriteConsumer(schema, writer);
    }

    @Override
    public String toString() { return "Write(" + file + ")"; }
}
