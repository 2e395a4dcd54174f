package clean.engine.profile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Writes column profiles as a JSON report.
 */
public class ProfileReportWriter {
    private static final Logger LOG = LoggerFactory.getLogger(ProfileReportWriter.class);

    private final Path outDir;
    private final int topK;

    public ProfileReportWriter(Path outDir) {
        this(outDir, 10);
    }

    public ProfileReportWriter(Path outDir, int topK) {
        this.outDir = outDir;
        this.topK = topK;
    }

    /**
     * Write the report to {@code profile_<dataset>_<timestamp>.json} in the
     * output directory and return the file.
     */
    public Path writeJson(String dataset, List<ColumnProfile> profiles) {
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path json = outDir.resolve("profile_" + dataset + "_" + ts + ".json");
        try {
            if (!Files.exists(outDir)) Files.createDirectories(outDir);
            Files.writeString(json, toJson(dataset, profiles));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed writing profile report " + json, e);
        }
        LOG.info("Wrote profile of {} column(s) to {}", profiles.size(), json);
        return json;
    }

    public String toJson(String dataset, List<ColumnProfile> profiles) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("dataset", dataset);
        Map<String, Object> columns = new LinkedHashMap<>();
        for (ColumnProfile p : profiles) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("total", p.total());
            entry.put("empty", p.emptyCount());
            entry.put("distinct", p.distinctCount());
            Map<String, Object> top = new LinkedHashMap<>();
            p.topValues(topK).forEach((value, count) -> top.put(String.valueOf(value), count));
            entry.put("top_values", top);
            NumericStats s = p.numeric();
            if (s.count() > 0) {
                Map<String, Object> numeric = new LinkedHashMap<>();
                numeric.put("count", s.count());
                // Round to sensible decimals (mean/stddev 2dp, others 3dp)
                numeric.put("min", Math.round(s.min() * 1000.0) / 1000.0);
                numeric.put("max", Math.round(s.max() * 1000.0) / 1000.0);
                numeric.put("mean", Math.round(s.mean() * 100.0) / 100.0);
                numeric.put("median", Math.round(s.median() * 1000.0) / 1000.0);
                numeric.put("stddev", Math.round(s.stddev() * 100.0) / 100.0);
                entry.put("numeric", numeric);
            }
            columns.put(p.column(), entry);
        }
        root.put("columns", columns);

        // Disable HTML escaping for readable values
        Gson gson = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();
        return gson.toJson(root);
    }
}
