package clean.engine.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import clean.engine.schema.Schema;
import clean.engine.stream.CollectingConsumer;

/** Feeds each profiled cell into its column profile. */
public class ProfileConsumer extends CollectingConsumer {
    private final int[] positions;
    private final List<ColumnProfile> profiles;

    public ProfileConsumer(Schema schema, int[] positions) {
        super(schema);
        this.positions = positions.clone();
        this.profiles = new ArrayList<>(positions.length);
        for (int p : positions) profiles.add(new ColumnProfile(schema.name(p)));
    }

    @Override
    protected void collect(Object rowId, List<Object> row) {
        for (int i = 0; i < positions.length; i++) profiles.get(i).add(row.get(positions[i]));
    }

    @Override
    protected Object result() { return Collections.unmodifiableList(profiles); }
}
