package gasmon.pipeline;

import gasmon.Event;
import gasmon.sink.Sink;
import gasmon.sink.SinkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;

/**
 * A chain of stages terminated by a {@link Sink}. Running the pipeline pulls the source through
 * every stage exactly once and hands the surviving events to the sink. To feed more than one
 * sink from the same pass, attach a {@link Sink#parallel(Sink...)} sink.
 */
public final class Pipeline {
    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    private final Stage stage;
    private final Sink sink;

    Pipeline(Stage stage, Sink sink) {
        this.stage = Objects.requireNonNull(stage, "Stage cannot be null.");
        this.sink = Objects.requireNonNull(sink, "Sink cannot be null.");
    }

    /**
     * Pulls events from the source through the stages and into the sink until the stream ends.
     *
     * @param source the raw event stream
     * @throws SinkException if the sink fails to aggregate or emit its results
     */
    public void run(Iterator<Event> source) throws SinkException {
        Objects.requireNonNull(source, "Event source cannot be null.");
        logger.debug("Running pipeline into sink {}", sink.getClass().getSimpleName());
        sink.handle(stage.apply(source));
    }
}
