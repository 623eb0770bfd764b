package gasmon.pipeline;

import gasmon.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

/**
 * A stage that drops events whose id was already seen within a trailing time-to-live window.
 * <p>
 * Admitted ids are remembered in a set together with a FIFO queue of expiry records. Since the
 * time-to-live is constant, records are queued in expiry order and are evicted from the front
 * before each incoming event is tested.
 */
public class DeduplicationStage implements Stage {
    private static final Logger logger = LoggerFactory.getLogger(DeduplicationStage.class);

    private final Duration timeToLive;
    private final Clock clock;

    private final Deque<DeduplicationRecord> expiryQueue = new ArrayDeque<>();
    private final Set<String> idCache = new HashSet<>();
    private long duplicateEventsIgnored = 0;

    public DeduplicationStage(int timeToLiveSeconds) {
        this(timeToLiveSeconds, Clock.systemUTC());
    }

    public DeduplicationStage(int timeToLiveSeconds, Clock clock) {
        if (timeToLiveSeconds < 0) {
            throw new IllegalArgumentException("Time to live cannot be negative. Received: " + timeToLiveSeconds);
        }
        this.timeToLive = Duration.ofSeconds(timeToLiveSeconds);
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null.");
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> events) {
        return new AbstractEventIterator() {
            @Override
            protected Event computeNext() {
                while (events.hasNext()) {
                    Event event = events.next();
                    if (admit(event, clock.instant())) {
                        return event;
                    }
                }
                return endOfData();
            }
        };
    }

    private boolean admit(Event event, Instant now) {
        while (!expiryQueue.isEmpty() && now.isAfter(expiryQueue.peekFirst().expiry())) {
            idCache.remove(expiryQueue.removeFirst().id());
            logger.debug("Expired deduplication record (Cache size: {})", idCache.size());
        }

        if (idCache.contains(event.eventId())) {
            logger.debug("Found duplicated event: {}", event.eventId());
            duplicateEventsIgnored++;
            return false;
        }

        idCache.add(event.eventId());
        expiryQueue.addLast(new DeduplicationRecord(now.plus(timeToLive), event.eventId()));
        return true;
    }

    /** @return The number of events dropped as duplicates. */
    public long getDuplicateEventsIgnored() {
        return duplicateEventsIgnored;
    }

    /** @return The number of ids currently remembered. */
    public int getCacheSize() {
        return idCache.size();
    }
}
