package gasmon;

import java.util.Objects;

/**
 * An immutable record representing a single sensor reading.
 * Stages and sinks only observe events; they never change them.
 *
 * @param locationId The identifier of the location the reading was taken at. Cannot be null.
 * @param eventId    The identifier of the reading, used to detect redelivered copies. Cannot be null.
 * @param timestamp  The time the reading was taken, in milliseconds since the epoch.
 * @param value      The measured value.
 */
public record Event(String locationId, String eventId, long timestamp, double value) {

    /**
     * Constructs a new Event.
     *
     * @throws NullPointerException if {@code locationId} or {@code eventId} is null.
     */
    public Event(String locationId, String eventId, long timestamp, double value) {
        this.locationId = Objects.requireNonNull(locationId, "Location ID cannot be null.");
        this.eventId = Objects.requireNonNull(eventId, "Event ID cannot be null.");
        this.timestamp = timestamp;
        this.value = value;
    }

    @Override
    public String toString() {
        return "Event[eventId='" + eventId + "', locationId='" + locationId + "', timestamp=" + timestamp + ", value=" + value + "]";
    }
}
