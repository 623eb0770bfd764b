package gasmon.pipeline;

import gasmon.Event;
import gasmon.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Iterator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A stage that drops events reported for a location that is not in the known set.
 */
public class LocationFilterStage implements Stage {
    private static final Logger logger = LoggerFactory.getLogger(LocationFilterStage.class);

    private final Set<String> validLocationIds;
    private long invalidEventsFiltered = 0;

    public LocationFilterStage(Collection<Location> validLocations) {
        this.validLocationIds = validLocations.stream()
                .map(Location::id)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> events) {
        return new AbstractEventIterator() {
            @Override
            protected Event computeNext() {
                while (events.hasNext()) {
                    Event event = events.next();
                    if (validLocationIds.contains(event.locationId())) {
                        return event;
                    }
                    logger.debug("Ignoring event with unknown location ID: {}", event.locationId());
                    invalidEventsFiltered++;
                }
                return endOfData();
            }
        };
    }

    /** @return The number of events dropped because of an unknown location. */
    public long getInvalidEventsFiltered() {
        return invalidEventsFiltered;
    }
}
