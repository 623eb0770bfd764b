package gasmon;

import java.util.Objects;

/**
 * An immutable record describing a known sensor location and its coordinates.
 *
 * @param id The unique identifier of the location. Cannot be null or blank.
 * @param x  The x coordinate of the location.
 * @param y  The y coordinate of the location.
 */
public record Location(String id, double x, double y) {

    /**
     * Constructs a new Location.
     *
     * @throws NullPointerException if {@code id} is null.
     * @throws IllegalArgumentException if {@code id} is blank.
     */
    public Location(String id, double x, double y) {
        this.id = Objects.requireNonNull(id, "Location ID cannot be null.");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Location ID cannot be blank.");
        }
        this.x = x;
        this.y = y;
    }
}
