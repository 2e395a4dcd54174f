package clean.engine.stream;

import java.util.Iterator;

/**
 * Iterator over the rows of an opened data source. Readers hold resources
 * (file handles, open consumer chains) and must be closed.
 */
public interface RowReader extends Iterator<Row>, AutoCloseable {
    @Override
    void close();
}
