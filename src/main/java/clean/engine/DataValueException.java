package clean.engine;

/**
 * Raised when a function configured to fail on bad input meets a value it cannot handle.
 */
public class DataValueException extends RuntimeException {
    private final transient Object value;

    public DataValueException(String message, Object value) {
        super(message);
        this.value = value;
    }

    public Object value() { return value; }
}
