package clean.engine.format;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import clean.engine.storage.Table;
import clean.engine.stream.Row;

/**
 * Renders in-memory tables as boxed ASCII text for logs and debugging.
 * Nulls are shown as {@code null}. Long tables can be cut off after a number
 * of rows; the footer always reports the full row count.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(Table table, PrintStream out) {
        out.print(render(table));
    }

    public static String render(Table table) {
        return render(table, Integer.MAX_VALUE);
    }

    /** Render at most {@code maxRows} rows, followed by a "..." line when rows were left out. */
    public static String render(Table table, int maxRows) {
        if (maxRows < 0) throw new IllegalArgumentException("maxRows must be >= 0");
        List<String> header = table.schema().columns();
        List<List<String>> cells = new ArrayList<>();
        for (Row r : table.rows()) {
            if (cells.size() == maxRows) break;
            List<String> line = new ArrayList<>(r.size());
            for (Object v : r.values()) line.add(String.valueOf(v));
            cells.add(line);
        }

        int[] widths = header.stream().mapToInt(String::length).toArray();
        for (List<String> line : cells) {
            for (int i = 0; i < widths.length; i++) widths[i] = Math.max(widths[i], line.get(i).length());
        }

        String rule = rule(widths);
        StringBuilder out = new StringBuilder();
        out.append(rule).append(line(header, widths)).append(rule);
        for (List<String> line : cells) out.append(line(line, widths));
        if (cells.size() < table.size()) out.append("...\n");
        if (!cells.isEmpty()) out.append(rule);
        out.append('(').append(table.size()).append(" row(s))\n");
        return out.toString();
    }

    private static String rule(int[] widths) {
        StringBuilder rule = new StringBuilder("+");
        for (int w : widths) rule.append("-".repeat(w + 2)).append('+');
        return rule.append('\n').toString();
    }

    private static String line(List<String> values, int[] widths) {
        StringBuilder line = new StringBuilder("|");
        for (int i = 0; i < widths.length; i++) {
            String v = values.get(i);
            line.append(' ').append(v).append(" ".repeat(widths[i] - v.length())).append(" |");
        }
        return line.append('\n').toString();
    }
}
