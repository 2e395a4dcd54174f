package clean.engine;

/**
 * Raised for programmer misuse detected while a pipeline is built or opened:
 * unknown or duplicate columns, function results that do not fit the target
 * columns, aggregate schemas of the wrong size.
 */
public class PipelineConfigurationException extends IllegalArgumentException {
    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
