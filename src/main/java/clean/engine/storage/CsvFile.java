package clean.engine.storage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import clean.engine.PipelineConfigurationException;
import clean.engine.schema.Schema;
import clean.engine.stream.DataSource;
import clean.engine.stream.RowReader;

/**
 * Delimited text file as a row source. Every {@link #open()} re-reads the
 * file from the start; row ids are the zero-based line numbers of the data
 * rows (as {@code Long}).
 */
public final class CsvFile implements DataSource {
    private final Path file;
    private final CsvOptions options;
    private Schema schema; // read from the header line on first use

    public CsvFile(Path file) {
        this(file, CsvOptions.forFile(file));
    }

    public CsvFile(Path file, CsvOptions options) {
        if (file == null) throw new IllegalArgumentException("file must not be null");
        this.file = file;
        this.options = options != null ? options : CsvOptions.forFile(file);
    }

    public Path file() { return file; }
    public CsvOptions options() { return options; }

    @Override
    public Schema schema() {
        if (schema == null) {
            if (!options.hasHeaderLine()) {
                schema = new Schema(options.header());
            } else {
                try (CsvRowReader reader = new CsvRowReader(file, options)) {
                    schema = reader.schema();
                }
            }
        }
        return schema;
    }

    @Override
    public RowReader open() {
        return new CsvRowReader(file, options);
    }

    /** Write a table to a file in the given format. */
    public static CsvFile write(Table table, Path file, CsvOptions options) {
        try (CsvRowWriter writer = new CsvRowWriter(file, options)) {
            writer.writeHeader(table.schema());
            table.rows().forEach(r -> writer.write(r.values()));
        }
        return new CsvFile(file, options.withHeader(null));
    }

    static Reader openReader(Path file, CsvOptions options) {
        try {
            InputStream in = Files.newInputStream(file);
            if (options.compressed()) in = new GZIPInputStream(in);
            return new BufferedReader(new InputStreamReader(in, options.charset()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed opening " + file, e);
        }
    }

    static Writer openWriter(Path file, CsvOptions options) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            OutputStream out = Files.newOutputStream(file);
            if (options.compressed()) out = new GZIPOutputStream(out);
            return new BufferedWriter(new OutputStreamWriter(out, options.charset()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed creating " + file, e);
        }
    }

    static void requireHeader(String[] header, Path file) {
        if (header == null) throw new PipelineConfigurationException("File has no header line: " + file);
    }

    @Override
    public String toString() { return "CsvFile(" + file + ")"; }
}
