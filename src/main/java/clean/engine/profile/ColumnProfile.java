package clean.engine.profile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value statistics for one column: total and empty counts, value
 * frequencies, and numeric statistics over the values that are numbers or
 * parse as numbers.
 */
public class ColumnProfile {
    private final String column;
    private final Map<Object, Long> frequencies = new HashMap<>();
    private final NumericStats numeric = new NumericStats();
    private long total;
    private long empty;

    public ColumnProfile(String column) {
        this.column = column;
    }

    public void add(Object value) {
        total++;
        if (value == null || (value instanceof String s && s.isBlank())) {
            empty++;
            return;
        }
        frequencies.merge(value, 1L, Long::sum);
        Double d = asNumber(value);
        if (d != null) numeric.add(d);
    }

    static Double asNumber(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                double d = Double.parseDouble(s.trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public String column() { return column; }
    public long total() { return total; }
    public long emptyCount() { return empty; }
    public int distinctCount() { return frequencies.size(); }
    public NumericStats numeric() { return numeric; }

    public long count(Object value) {
        return frequencies.getOrDefault(value, 0L);
    }

    /**
     * The k most frequent non-empty values with their counts. Ties are broken
     * by the string form of the value.
     */
    public Map<Object, Long> topValues(int k) {
        List<Map.Entry<Object, Long>> entries = new ArrayList<>(frequencies.entrySet());
        entries.sort(Comparator.<Map.Entry<Object, Long>>comparingLong(Map.Entry::getValue).reversed()
            .thenComparing(e -> String.valueOf(e.getKey())));
        Map<Object, Long> top = new LinkedHashMap<>();
        for (Map.Entry<Object, Long> e : entries) {
            if (top.size() >= k) break;
            top.put(e.getKey(), e.getValue());
        }
        return top;
    }

    @Override
    public String toString() {
        return "ColumnProfile(" + column + ", total=" + total + ", empty=" + empty + ", distinct=" + distinctCount() + ")";
    }
}
