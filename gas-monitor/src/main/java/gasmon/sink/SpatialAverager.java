package gasmon.sink;

import gasmon.Centroid;
import gasmon.Event;
import gasmon.Location;
import gasmon.output.ResultWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A sink that computes the value-weighted average position of all events in one pass:
 * each event pulls the centroid towards its location in proportion to its value.
 * The centroid is computed and written once the stream ends.
 */
public class SpatialAverager implements Sink {
    private static final Logger logger = LoggerFactory.getLogger(SpatialAverager.class);

    private final Map<String, Location> locationsById;
    private final ResultWriter<Centroid> writer;
    private Centroid centroid;

    public SpatialAverager(Collection<Location> locations, ResultWriter<Centroid> writer) {
        this.locationsById = locations.stream()
                .collect(Collectors.toUnmodifiableMap(Location::id, Function.identity(), (first, second) -> first));
        this.writer = Objects.requireNonNull(writer, "Result writer cannot be null.");
    }

    /**
     * Consumes the stream and writes the resulting centroid.
     *
     * @throws EmptyAggregateException if the values of the consumed events sum to zero
     * @throws AggregateOutputException if the centroid could not be written
     */
    @Override
    public void handle(Iterator<Event> events) throws SinkException {
        double weightedX = 0;
        double weightedY = 0;
        double totalValue = 0;
        long counted = 0;

        while (events.hasNext()) {
            Event event = events.next();
            Location location = locationsById.get(event.locationId());
            if (location == null) {
                logger.warn("No coordinates for location {}; event {} not included in the centroid.",
                        event.locationId(), event.eventId());
                continue;
            }
            weightedX += location.x() * event.value();
            weightedY += location.y() * event.value();
            totalValue += event.value();
            counted++;
        }

        if (totalValue == 0) {
            throw new EmptyAggregateException(
                    "Cannot compute a weighted location: total value of " + counted + " events is zero.");
        }

        Centroid result = new Centroid(weightedX / totalValue, weightedY / totalValue);
        this.centroid = result;
        logger.info("Weighted location over {} events is ({}, {})", counted, result.x(), result.y());

        try {
            writer.write(result);
        } catch (IOException e) {
            logger.error("Failed to write weighted location {}", result, e);
            throw new AggregateOutputException("Could not write weighted location", e);
        }
    }

    /** @return The centroid of the last completed pass, if any. */
    public Optional<Centroid> getCentroid() {
        return Optional.ofNullable(centroid);
    }
}
