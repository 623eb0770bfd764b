package gasmon;

import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Generates synthetic sensor events for known locations.
 * A configurable share of the generated events repeats the previous event (same id) or reports
 * a location that is not in the known list, so that downstream filtering has work to do.
 * Not thread-safe; use one generator per publishing thread.
 */
public class EventGenerator {

    private static final double MEAN_VALUE = 5.0;
    private static final double VALUE_SPREAD = 2.0;

    private final List<Location> locations;
    private final double duplicateRatio;
    private final double invalidLocationRatio;
    private final Random random;
    private final LongSupplier timeSource;

    private Event previous;

    public EventGenerator(List<Location> locations, double duplicateRatio, double invalidLocationRatio) {
        this(locations, duplicateRatio, invalidLocationRatio, new Random(), System::currentTimeMillis);
    }

    EventGenerator(List<Location> locations, double duplicateRatio, double invalidLocationRatio,
                   Random random, LongSupplier timeSource) {
        if (locations == null || locations.isEmpty()) {
            throw new IllegalArgumentException("At least one known location is required.");
        }
        checkRatio("duplicateRatio", duplicateRatio);
        checkRatio("invalidLocationRatio", invalidLocationRatio);
        this.locations = List.copyOf(locations);
        this.duplicateRatio = duplicateRatio;
        this.invalidLocationRatio = invalidLocationRatio;
        this.random = random;
        this.timeSource = timeSource;
    }

    /**
     * Generates the next event.
     *
     * @return either a copy of the previous event or a new event with a unique id
     */
    public Event nextEvent() {
        if (previous != null && random.nextDouble() < duplicateRatio) {
            return previous;
        }

        String locationId = random.nextDouble() < invalidLocationRatio
                ? "unknown-" + UUID.randomUUID()
                : locations.get(random.nextInt(locations.size())).id();
        double value = Math.max(0.0, MEAN_VALUE + VALUE_SPREAD * random.nextGaussian());

        previous = new Event(locationId, UUID.randomUUID().toString(), timeSource.getAsLong(), value);
        return previous;
    }

    private static void checkRatio(String name, double ratio) {
        if (ratio < 0.0 || ratio > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0 and 1. Received: " + ratio);
        }
    }
}
