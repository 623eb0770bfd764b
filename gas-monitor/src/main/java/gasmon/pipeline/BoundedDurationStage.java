package gasmon.pipeline;

import gasmon.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.Objects;

/**
 * A stage that passes events on for a fixed amount of wall-clock time.
 * The deadline is fixed when the first element is requested; once it has passed the stream ends
 * and no further upstream element is pulled.
 */
public class BoundedDurationStage implements Stage {
    private static final Logger logger = LoggerFactory.getLogger(BoundedDurationStage.class);

    private final int runTimeSeconds;
    private final Clock clock;
    private long eventsProcessed = 0;

    public BoundedDurationStage(int runTimeSeconds) {
        this(runTimeSeconds, Clock.systemUTC());
    }

    public BoundedDurationStage(int runTimeSeconds, Clock clock) {
        if (runTimeSeconds <= 0) {
            throw new IllegalArgumentException("Run time must be positive. Received: " + runTimeSeconds);
        }
        this.runTimeSeconds = runTimeSeconds;
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null.");
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> events) {
        return new AbstractEventIterator() {
            private long deadline = -1;

            @Override
            protected Event computeNext() {
                if (deadline < 0) {
                    deadline = clock.millis() + runTimeSeconds * 1000L;
                    logger.info("Processing events for {} seconds", runTimeSeconds);
                }
                if (clock.millis() >= deadline || !events.hasNext()) {
                    logger.info("Finished processing events");
                    return endOfData();
                }
                Event event = events.next();
                if (clock.millis() >= deadline) {
                    logger.info("Finished processing events");
                    return endOfData();
                }
                logger.debug("Processing event: {}", event);
                eventsProcessed++;
                return event;
            }
        };
    }

    public int getRunTimeSeconds() {
        return runTimeSeconds;
    }

    /** @return The number of events passed on so far. */
    public long getEventsProcessed() {
        return eventsProcessed;
    }
}
