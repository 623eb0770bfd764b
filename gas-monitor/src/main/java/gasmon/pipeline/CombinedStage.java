package gasmon.pipeline;

import gasmon.Event;

import java.util.Iterator;
import java.util.Objects;

/**
 * A stage made up of two other stages, applied one after the other.
 */
final class CombinedStage implements Stage {

    private final Stage first;
    private final Stage second;

    CombinedStage(Stage first, Stage second) {
        this.first = Objects.requireNonNull(first, "First stage cannot be null.");
        this.second = Objects.requireNonNull(second, "Second stage cannot be null.");
    }

    @Override
    public Iterator<Event> apply(Iterator<Event> events) {
        return second.apply(first.apply(events));
    }
}
