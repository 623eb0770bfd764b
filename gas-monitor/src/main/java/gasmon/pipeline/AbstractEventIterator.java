package gasmon.pipeline;

import gasmon.Event;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Base for the lazy iterators returned by stages. Subclasses produce one element at a time
 * from {@link #computeNext()} and call {@link #endOfData()} once nothing further will follow.
 * Nothing is pulled from upstream until {@link #hasNext()} or {@link #next()} is called.
 */
abstract class AbstractEventIterator implements Iterator<Event> {

    private Event next;
    private boolean ready;
    private boolean done;

    /**
     * Computes the next element, pulling as much upstream input as needed.
     *
     * @return the next element, or the result of {@link #endOfData()} when the stream is over
     */
    protected abstract Event computeNext();

    protected final Event endOfData() {
        done = true;
        return null;
    }

    @Override
    public final boolean hasNext() {
        if (done) {
            return false;
        }
        if (!ready) {
            next = computeNext();
            ready = !done;
        }
        return ready;
    }

    @Override
    public final Event next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ready = false;
        Event result = next;
        next = null;
        return result;
    }
}
