package clean.engine.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;

import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;

import clean.engine.schema.Schema;

/**
 * Writes rows to a delimited text file. Null values are written as the null
 * token (or as empty fields when there is none); other values by their
 * string form. Fields are quoted only where needed.
 */
public class CsvRowWriter implements AutoCloseable {
    private final Path file;
    private final CsvOptions options;
    private final ICSVWriter csv;
    private long rows;
    private boolean closed;

    public CsvRowWriter(Path file, CsvOptions options) {
        this.file = file;
        this.options = options;
        this.csv = new CSVWriterBuilder(CsvFile.openWriter(file, options))
            .withSeparator(options.delimiter())
            .withQuoteChar(options.quoteChar())
            .withEscapeChar(options.quoteChar())
            .withLineEnd(ICSVWriter.DEFAULT_LINE_END)
            .build();
    }

    public Path file() { return file; }
    public long rowCount() { return rows; }

    public void writeHeader(Schema schema) {
        csv.writeNext(schema.columns().toArray(new String[0]), false);
        try {
            csv.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing header to " + file, e);
        }
    }

    public void write(List<Object> values) {
        if (closed) throw new IllegalStateException("Writer for " + file + " is closed");
        String[] line = new String[values.size()];
        for (int i = 0; i < line.length; i++) line[i] = encode(values.get(i));
        csv.writeNext(line, false);
        rows++;
    }

    private String encode(Object value) {
        if (value == null) return options.nullToken() != null ? options.nullToken() : "";
        return value.toString();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            csv.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed closing " + file, e);
        }
    }
}
