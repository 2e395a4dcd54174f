package clean.engine.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference to a column either by name or by index position in a schema.
 * Exactly one of the two is set.
 */
public record ColumnRef(String name, int index) {

    public ColumnRef {
        if (name == null && index < 0) {
            throw new IllegalArgumentException("Column reference needs a name or a non-negative index");
        }
    }

    public static ColumnRef name(String name) {
        if (name == null) throw new IllegalArgumentException("Column name must not be null");
        return new ColumnRef(name, -1);
    }

    public static ColumnRef index(int index) {
        if (index < 0) throw new IllegalArgumentException("Column index must be non-negative: " + index);
        return new ColumnRef(null, index);
    }

    public static List<ColumnRef> names(String... names) {
        List<ColumnRef> refs = new ArrayList<>(names.length);
        for (String n : names) refs.add(name(n));
        return refs;
    }

    public static List<ColumnRef> indexes(int... indexes) {
        List<ColumnRef> refs = new ArrayList<>(indexes.length);
        for (int i : indexes) refs.add(index(i));
        return refs;
    }

    public boolean byName() { return name != null; }

    @Override
    public String toString() { return byName() ? name : "#" + index; }
}
