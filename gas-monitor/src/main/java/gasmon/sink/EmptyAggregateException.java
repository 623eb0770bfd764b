package gasmon.sink;

/**
 * Thrown when an aggregate is requested over input that carries no weight,
 * for example a weighted average whose total weight is zero.
 */
public class EmptyAggregateException extends SinkException {
    public EmptyAggregateException(String message) {
        super(message);
    }
}
