package gasmon.pipeline;

import java.time.Instant;

/**
 * Tracks when an admitted event id stops counting as a duplicate.
 *
 * @param expiry The wall-clock instant after which the id is forgotten.
 * @param id     The event id.
 */
record DeduplicationRecord(Instant expiry, String id) {
}
