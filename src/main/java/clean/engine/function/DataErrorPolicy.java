package clean.engine.function;

import clean.engine.DataValueException;

/**
 * What a function does with a value it cannot process: raise a
 * {@link DataValueException}, return a fixed default, or return the value
 * unchanged. The policy is chosen when the function is constructed.
 */
public final class DataErrorPolicy {
    public enum Mode { RAISE, DEFAULT, PASS_THROUGH }

    private static final DataErrorPolicy RAISE = new DataErrorPolicy(Mode.RAISE, null);
    private static final DataErrorPolicy PASS_THROUGH = new DataErrorPolicy(Mode.PASS_THROUGH, null);

    private final Mode mode;
    private final Object defaultValue;

    private DataErrorPolicy(Mode mode, Object defaultValue) {
        this.mode = mode;
        this.defaultValue = defaultValue;
    }

    public static DataErrorPolicy raise() { return RAISE; }
    public static DataErrorPolicy passThrough() { return PASS_THROUGH; }
    public static DataErrorPolicy useDefault(Object value) { return new DataErrorPolicy(Mode.DEFAULT, value); }

    public Mode mode() { return mode; }

    public Object handle(Object value, String message) {
        return switch (mode) {
            case RAISE -> throw new DataValueException(message, value);
            case DEFAULT -> defaultValue;
            case PASS_THROUGH -> value;
        };
    }

    @Override
    public String toString() {
        return mode == Mode.DEFAULT ? "DEFAULT(" + defaultValue + ")" : mode.name();
    }
}
