package gasmon;

/**
 * The final average of all values collected in a retired time bin.
 *
 * @param start The inclusive start of the bin, in milliseconds since the epoch.
 * @param end   The exclusive end of the bin, in milliseconds since the epoch.
 * @param value The arithmetic mean of the bin's values, or 0 if the bin received none.
 */
public record Average(long start, long end, double value) {

    public Average {
        if (end < start) {
            throw new IllegalArgumentException("Average end (" + end + ") cannot be before its start (" + start + ").");
        }
    }
}
