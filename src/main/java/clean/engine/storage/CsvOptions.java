package clean.engine.storage;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import clean.engine.PipelineConfigurationException;

/**
 * Format options for delimited text files.
 * <p>
 * {@code header} is the list of column names when the file itself has no
 * header line; when it is null the first line of the file is the header.
 * {@code nullToken} is the string that reads as null and is written for null
 * values (null: no token, nulls are written as empty fields).
 */
public record CsvOptions(char delimiter, char quoteChar, List<String> header, String nullToken,
                         boolean compressed, Charset charset) {

    public static final char DEFAULT_DELIMITER = ',';
    public static final char DEFAULT_QUOTE = '"';

    public CsvOptions {
        if (delimiter == quoteChar) {
            throw new PipelineConfigurationException("Delimiter and quote character must differ: " + delimiter);
        }
        header = header != null ? List.copyOf(header) : null;
        charset = charset != null ? charset : StandardCharsets.UTF_8;
    }

    public static CsvOptions defaults() {
        return new CsvOptions(DEFAULT_DELIMITER, DEFAULT_QUOTE, null, null, false, StandardCharsets.UTF_8);
    }

    /**
     * Options inferred from the file name: tab-delimited for {@code .tsv},
     * gzip-compressed for {@code .gz} (e.g. {@code data.tsv.gz}).
     */
    public static CsvOptions forFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean gz = name.endsWith(".gz");
        if (gz) name = name.substring(0, name.length() - 3);
        char delim = name.endsWith(".tsv") ? '\t' : DEFAULT_DELIMITER;
        return new CsvOptions(delim, DEFAULT_QUOTE, null, null, gz, StandardCharsets.UTF_8);
    }

    public CsvOptions withDelimiter(char d) { return new CsvOptions(d, quoteChar, header, nullToken, compressed, charset); }
    public CsvOptions withQuoteChar(char q) { return new CsvOptions(delimiter, q, header, nullToken, compressed, charset); }
    public CsvOptions withHeader(List<String> h) { return new CsvOptions(delimiter, quoteChar, h, nullToken, compressed, charset); }
    public CsvOptions withNullToken(String t) { return new CsvOptions(delimiter, quoteChar, header, t, compressed, charset); }
    public CsvOptions withCompressed(boolean c) { return new CsvOptions(delimiter, quoteChar, header, nullToken, c, charset); }
    public CsvOptions withCharset(Charset c) { return new CsvOptions(delimiter, quoteChar, header, nullToken, compressed, c); }

    public boolean hasHeaderLine() { return header == null; }

    // Field names of the JSON document
    private static final class Json {
        String delimiter;
        String quote;
        List<String> header;
        String nullToken;
        Boolean compressed;
        String charset;
    }

    /**
     * Load options from a JSON document such as
     * {@code {"delimiter": "\t", "nullToken": "NA", "header": ["A", "B"]}}.
     * Missing fields keep the defaults.
     */
    public static CsvOptions fromJson(Reader reader) {
        Json json;
        try {
            json = new Gson().fromJson(reader, Json.class);
        } catch (JsonParseException e) {
            throw new PipelineConfigurationException("Invalid CSV options document: " + e.getMessage(), e);
        }
        CsvOptions opts = defaults();
        if (json == null) return opts;
        if (json.delimiter != null) opts = opts.withDelimiter(singleChar("delimiter", json.delimiter));
        if (json.quote != null) opts = opts.withQuoteChar(singleChar("quote", json.quote));
        if (json.header != null) opts = opts.withHeader(json.header);
        if (json.nullToken != null) opts = opts.withNullToken(json.nullToken);
        if (json.compressed != null) opts = opts.withCompressed(json.compressed);
        if (json.charset != null) {
            try {
                opts = opts.withCharset(Charset.forName(json.charset));
            } catch (IllegalArgumentException e) {
                throw new PipelineConfigurationException("Unknown charset: " + json.charset, e);
            }
        }
        return opts;
    }

    public static CsvOptions fromJson(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed loading CSV options: " + file, e);
        }
    }

    private static char singleChar(String field, String value) {
        if (value.length() != 1) {
            throw new PipelineConfigurationException(field + " must be a single character: '" + value + "'");
        }
        return value.charAt(0);
    }
}
