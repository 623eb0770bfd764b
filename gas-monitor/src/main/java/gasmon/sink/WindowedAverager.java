package gasmon.sink;

import gasmon.Average;
import gasmon.Event;
import gasmon.output.ResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A sink that computes a moving average over fixed-width time bins.
 * <p>
 * Events are sorted into a contiguous run of bins of {@code averagingPeriodSeconds} width by their
 * own timestamps. A bin is finalised into an {@link Average} once its end lies more than
 * {@code expirySeconds} behind the current time; at most one bin is finalised per event. Events
 * older than the first retained bin are dropped, as are events stamped more than
 * {@code expirySeconds} ahead of the current time.
 * <p>
 * Not thread-safe; a single consumer drives it.
 */
public class WindowedAverager implements Sink {
    private static final Logger logger = LoggerFactory.getLogger(WindowedAverager.class);

    private final long averagingPeriodMillis;
    private final long expiryTimeMillis;
    private final Clock clock;
    private final ResultWriter<Average> writer;

    private final Deque<Bin> bins = new ArrayDeque<>();
    private long averagesEmitted = 0;

    public WindowedAverager(int averagingPeriodSeconds, int expirySeconds, ResultWriter<Average> writer) {
        this(averagingPeriodSeconds, expirySeconds, writer, Clock.systemUTC());
    }

    public WindowedAverager(int averagingPeriodSeconds, int expirySeconds, ResultWriter<Average> writer, Clock clock) {
        if (averagingPeriodSeconds <= 0) {
            throw new IllegalArgumentException("Averaging period must be positive. Received: " + averagingPeriodSeconds);
        }
        if (expirySeconds <= 0) {
            throw new IllegalArgumentException("Expiry time must be positive. Received: " + expirySeconds);
        }
        if (expirySeconds < averagingPeriodSeconds) {
            logger.warn("Expiry time ({}s) is shorter than the averaging period ({}s); bins may be finalised before they fill.",
                    expirySeconds, averagingPeriodSeconds);
        }
        this.averagingPeriodMillis = averagingPeriodSeconds * 1000L;
        this.expiryTimeMillis = expirySeconds * 1000L;
        this.writer = Objects.requireNonNull(writer, "Result writer cannot be null.");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null.");

        long seed = clock.millis() - expiryTimeMillis;
        bins.addLast(new Bin(seed, seed));
    }

    /**
     * Consumes the whole stream. A failed write does not stop averaging: later bins are still
     * finalised and written, and the first failure is rethrown once the stream ends with any
     * further failures attached as suppressed exceptions.
     */
    @Override
    public void handle(Iterator<Event> events) throws SinkException {
        AggregateOutputException failure = null;
        while (events.hasNext()) {
            try {
                accept(events.next());
            } catch (AggregateOutputException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        logger.info("Averaging finished with {} bins still open and {} averages emitted.", bins.size(), averagesEmitted);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Adds one event and finalises the oldest bin if it has expired.
     *
     * @param event the event to add
     * @throws AggregateOutputException if the finalised average could not be written; the bin is
     *                                  retired regardless and later events are handled normally
     */
    public void accept(Event event) throws AggregateOutputException {
        addToBin(event);
        Average average = maybeExpireFirstBin();
        if (average != null) {
            emit(average);
        }
    }

    private void addToBin(Event event) {
        long timestamp = event.timestamp();
        if (timestamp < bins.peekFirst().getStart()) {
            logger.debug("Not averaging old event at timestamp {}", timestamp);
            return;
        }
        long horizon = clock.millis() + expiryTimeMillis;
        if (timestamp > horizon) {
            logger.warn("Not averaging event {} at timestamp {}, more than {}s in the future",
                    event.eventId(), timestamp, expiryTimeMillis / 1000);
            return;
        }

        while (timestamp >= bins.peekLast().getEnd()) {
            Bin last = bins.peekLast();
            logger.debug("Adding new bin for event at timestamp {} (current last bin is {} to {})",
                    timestamp, last.getStart(), last.getEnd());
            bins.addLast(new Bin(last.getEnd(), last.getEnd() + averagingPeriodMillis));
        }

        // Recent events land near the back, so search from there.
        Iterator<Bin> newestFirst = bins.descendingIterator();
        while (newestFirst.hasNext()) {
            Bin bin = newestFirst.next();
            if (bin.contains(timestamp)) {
                bin.add(event.value());
                return;
            }
        }
        throw new IllegalStateException("No bin covers timestamp " + timestamp + " although bins are contiguous.");
    }

    private Average maybeExpireFirstBin() {
        long now = clock.millis();
        Bin first = bins.peekFirst();
        if (now - expiryTimeMillis <= first.getEnd()) {
            return null;
        }

        bins.removeFirst();
        if (bins.isEmpty()) {
            long seed = Math.max(first.getEnd(), now - expiryTimeMillis);
            bins.addLast(new Bin(seed, seed));
        }
        // The zero-width seed bin only anchors the first real bin.
        if (first.isEmptyInterval()) {
            return null;
        }
        return first.toAverage();
    }

    private void emit(Average average) throws AggregateOutputException {
        averagesEmitted++;
        logger.info("Average value for {} to {} is {}", average.start(), average.end(), average.value());
        try {
            writer.write(average);
        } catch (IOException e) {
            logger.error("Failed to write average for bin {} to {}", average.start(), average.end(), e);
            throw new AggregateOutputException("Could not write average for bin starting at " + average.start(), e);
        }
    }

    /** @return A snapshot of the currently open bins, oldest first. */
    public List<Bin> getBins() {
        return List.copyOf(bins);
    }

    public long getAveragesEmitted() {
        return averagesEmitted;
    }
}
