package gasmon;

/**
 * A value-weighted average position over a set of readings.
 *
 * @param x The weighted x coordinate.
 * @param y The weighted y coordinate.
 */
public record Centroid(double x, double y) {
}
