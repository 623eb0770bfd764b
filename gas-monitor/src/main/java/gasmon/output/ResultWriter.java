package gasmon.output;

import java.io.IOException;

/**
 * Destination for finalised aggregation results.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface ResultWriter<T> {

    /**
     * Writes one result.
     *
     * @param result the result to write
     * @throws IOException if the result could not be written
     */
    void write(T result) throws IOException;
}
