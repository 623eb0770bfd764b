package gasmon.sink;

/**
 * Thrown when a finalised aggregate could not be written to its output.
 * The sink that raised it keeps a consistent state and can continue to accept events.
 */
public class AggregateOutputException extends SinkException {
    public AggregateOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
