package clean.engine.stream;

/**
 * Control-flow signal raised by a limit consumer once its quota is used up.
 * The pipeline driver treats it as a normal end of stream; it never reaches
 * the caller of a pipeline run.
 */
public final class LimitReachedException extends RuntimeException {
    private final long limit;

    public LimitReachedException(long limit) {
        super("Row limit of " + limit + " reached", null, false, false);
        this.limit = limit;
    }

    public long limit() { return limit; }
}
