package gasmon.sink;

import gasmon.Event;

import java.util.Iterator;
import java.util.List;

/**
 * The final consumer of the events that made it through a pipeline.
 */
public interface Sink {

    /**
     * Consumes every element of the given stream.
     *
     * @param events the events to consume; the call returns once the stream ends
     * @throws SinkException if the sink cannot produce or emit its result
     */
    void handle(Iterator<Event> events) throws SinkException;

    /**
     * Creates a sink that feeds a single pass over the stream to all the given sinks.
     *
     * @param sinks the sinks that each receive every event
     * @return the combined sink
     */
    static Sink parallel(Sink... sinks) {
        return new ParallelSink(List.of(sinks));
    }
}
