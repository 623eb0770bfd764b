package gasmon.sink;

/**
 * Base checked exception for failures raised while a sink aggregates or emits results.
 */
public class SinkException extends Exception {
    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
