package clean.engine.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import clean.engine.storage.Table;

/**
 * Partition of the rows of a table by group key. Keys keep insertion order;
 * each key maps to the row ids of its group. Groups can be added (and
 * extended) until the grouping is read for the first time; from then on the
 * grouping is frozen. Sub-tables are built on first access.
 */
public class DataGrouping {
    private final Table table;
    private final Map<Object, List<Object>> groups = new LinkedHashMap<>();
    private final Map<Object, Table> subTables = new HashMap<>();
    private boolean frozen;

    public DataGrouping(Table table) {
        if (table == null) throw new IllegalArgumentException("table must not be null");
        this.table = table;
    }

    public Table table() { return table; }

    /** Append row ids to the group with the given key. */
    public void add(Object key, List<?> rowIds) {
        if (frozen) throw new IllegalStateException("Grouping is frozen after it has been read");
        groups.computeIfAbsent(key, k -> new ArrayList<>()).addAll(rowIds);
    }

    private Map<Object, List<Object>> read() {
        frozen = true;
        return groups;
    }

    public Set<Object> keys() { return Collections.unmodifiableSet(read().keySet()); }

    public int size() { return read().size(); }

    public boolean contains(Object key) { return read().containsKey(key); }

    /** Row ids of a group, or an empty list for an unknown key. */
    public List<Object> rows(Object key) {
        List<Object> ids = read().get(key);
        return ids != null ? Collections.unmodifiableList(ids) : List.of();
    }

    /** Rows of a group as a table, or null for an unknown key. */
    public Table group(Object key) {
        List<Object> ids = read().get(key);
        if (ids == null) return null;
        return subTables.computeIfAbsent(key, k -> table.subset(ids));
    }

    /** Group keys with their sub-tables, in key order. */
    public Map<Object, Table> groups() {
        Map<Object, Table> all = new LinkedHashMap<>();
        for (Object key : read().keySet()) all.put(key, group(key));
        return Collections.unmodifiableMap(all);
    }

    @Override
    public String toString() { return "DataGrouping" + groups.keySet(); }
}
