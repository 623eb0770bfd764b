package gasmon.pipeline;

import gasmon.Event;
import gasmon.sink.Sink;

import java.util.Iterator;

/**
 * A single step that events pass through on their way to a {@link Sink}.
 * A stage turns an event stream into another event stream lazily: an output element is only
 * computed when the returned iterator is asked for it, and elements keep their relative order.
 */
public interface Stage {

    /**
     * Wraps the given stream with this stage's transformation.
     *
     * @param events the upstream events
     * @return a lazy view of the events this stage lets through
     */
    Iterator<Event> apply(Iterator<Event> events);

    /**
     * Chains {@code next} after this stage.
     *
     * @param next the stage that receives this stage's output
     * @return a stage equivalent to applying this stage, then {@code next}
     */
    default Stage combine(Stage next) {
        return new CombinedStage(this, next);
    }

    /**
     * Terminates this stage with a sink.
     *
     * @param sink the consumer of every event this stage lets through
     * @return a runnable pipeline
     */
    default Pipeline sink(Sink sink) {
        return new Pipeline(this, sink);
    }
}
