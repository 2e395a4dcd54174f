package clean.engine.stream;

import clean.engine.schema.Schema;

/**
 * A restartable, finite source of rows with a stable schema. Every call to
 * {@link #open()} starts a new pass over the rows.
 */
public interface DataSource {
    Schema schema();

    RowReader open();
}
