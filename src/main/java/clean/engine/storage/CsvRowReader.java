package clean.engine.storage;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.exceptions.CsvValidationException;

import clean.engine.DataValueException;
import clean.engine.schema.Schema;
import clean.engine.stream.Row;
import clean.engine.stream.RowReader;

/**
 * Streams the data rows of a delimited text file. Cells equal to the null
 * token are read as null; every other cell is a string.
 */
public class CsvRowReader implements RowReader {
    private final Path file;
    private final CsvOptions options;
    private final CSVReader csv;
    private final Schema schema;
    private String[] pending;
    private long nextId;
    private boolean done;
    private boolean closed;

    public CsvRowReader(Path file, CsvOptions options) {
        this.file = file;
        this.options = options;
        Reader reader = CsvFile.openReader(file, options);
        this.csv = new CSVReaderBuilder(reader)
            .withCSVParser(new CSVParserBuilder()
                .withSeparator(options.delimiter())
                .withQuoteChar(options.quoteChar())
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .build())
            .build();
        try {
            if (options.hasHeaderLine()) {
                String[] header = readLine();
                CsvFile.requireHeader(header, file);
                this.schema = new Schema(Arrays.asList(header));
            } else {
                this.schema = new Schema(options.header());
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    public Schema schema() { return schema; }

    private String[] readLine() {
        try {
            return csv.readNext();
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading " + file, e);
        } catch (CsvValidationException e) {
            throw new UncheckedIOException("Malformed line " + e.getLineNumber() + " in " + file,
                new IOException(e.getMessage(), e));
        }
    }

    @Override
    public boolean hasNext() {
        if (closed || done) return false;
        if (pending == null) {
            pending = readLine();
            if (pending == null) done = true;
        }
        return pending != null;
    }

    @Override
    public Row next() {
        if (!hasNext()) throw new NoSuchElementException();
        String[] line = pending;
        pending = null;
        long id = nextId++;
        if (line.length != schema.size()) {
            throw new DataValueException("Row " + id + " in " + file + " has " + line.length
                + " values, expected " + schema.size(), Arrays.asList(line));
        }
        List<Object> values = new ArrayList<>(line.length);
        for (String cell : line) values.add(decode(cell));
        return new Row(id, values);
    }

    private Object decode(String cell) {
        return options.nullToken() != null && options.nullToken().equals(cell) ? null : cell;
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
