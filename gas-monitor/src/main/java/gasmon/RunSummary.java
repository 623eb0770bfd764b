package gasmon;

import java.util.Locale;

/**
 * Counters reported once a bounded run is over.
 *
 * @param eventsProcessed    Events that arrived before the deadline.
 * @param runTimeSeconds     The configured run time.
 * @param invalidLocations   Events dropped for an unknown location.
 * @param duplicates         Events dropped as duplicates.
 */
public record RunSummary(long eventsProcessed, int runTimeSeconds, long invalidLocations, long duplicates) {

    /** @return The throughput over the configured run time. */
    public double eventsPerSecond() {
        return runTimeSeconds == 0 ? 0.0 : (double) eventsProcessed / runTimeSeconds;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "Processed %d events in %d seconds%nEvents/s: %.2f%nInvalid locations skipped: %d%nDuplicated events skipped: %d",
                eventsProcessed, runTimeSeconds, eventsPerSecond(), invalidLocations, duplicates);
    }
}
