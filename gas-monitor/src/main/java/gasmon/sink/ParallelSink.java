package gasmon.sink;

import gasmon.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A sink that hands one pass over the incoming stream to several sinks.
 * <p>
 * The calling thread pulls the upstream stream exactly once and copies every element into one
 * unbounded queue per member sink. Each member consumes its own queue on a dedicated worker
 * thread, so a slow or failing member never holds up the others. Once the upstream stream ends,
 * this sink waits for every member to finish and rethrows the first failure, with any further
 * failures attached as suppressed exceptions.
 */
public class ParallelSink implements Sink {
    private static final Logger logger = LoggerFactory.getLogger(ParallelSink.class);

    private final List<Sink> sinks;

    ParallelSink(List<Sink> sinks) {
        if (sinks.isEmpty()) {
            throw new IllegalArgumentException("At least one sink is required.");
        }
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void handle(Iterator<Event> events) throws SinkException {
        List<BlockingQueue<Slot>> queues = new ArrayList<>(sinks.size());
        List<Future<?>> results = new ArrayList<>(sinks.size());
        ExecutorService executor = Executors.newFixedThreadPool(sinks.size(), new SinkThreadFactory());

        try {
            for (Sink sink : sinks) {
                BlockingQueue<Slot> queue = new LinkedBlockingQueue<>();
                queues.add(queue);
                results.add(executor.submit(() -> {
                    sink.handle(new QueueIterator(queue));
                    return null;
                }));
            }

            long pumped = 0;
            try {
                while (events.hasNext()) {
                    Slot slot = new Slot(events.next());
                    for (int i = 0; i < queues.size(); i++) {
                        // A member that already returned or failed will never drain its queue.
                        if (!results.get(i).isDone()) {
                            queues.get(i).add(slot);
                        }
                    }
                    pumped++;
                }
            } finally {
                for (BlockingQueue<Slot> queue : queues) {
                    queue.add(Slot.END);
                }
            }
            logger.debug("Broadcast {} events to {} sinks.", pumped, sinks.size());

            awaitAll(results);
        } finally {
            executor.shutdownNow();
        }
    }

    private void awaitAll(List<Future<?>> results) throws SinkException {
        SinkException failure = null;
        for (int i = 0; i < results.size(); i++) {
            SinkException error = null;
            try {
                results.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                error = new SinkException("Interrupted while waiting for sink " + describe(i), e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                logger.error("Sink {} failed: {}", describe(i), cause.getMessage());
                error = cause instanceof SinkException sinkException
                        ? sinkException
                        : new SinkException("Sink " + describe(i) + " failed unexpectedly", cause);
            }
            if (error != null) {
                if (failure == null) {
                    failure = error;
                } else {
                    failure.addSuppressed(error);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private String describe(int index) {
        return sinks.get(index).getClass().getSimpleName() + "#" + index;
    }

    /**
     * Queue element; {@link #END} marks the end of the stream.
     */
    private record Slot(Event event) {
        static final Slot END = new Slot(null);
    }

    /**
     * Blocking iterator over one member's queue.
     */
    private static final class QueueIterator implements Iterator<Event> {
        private final BlockingQueue<Slot> queue;
        private Slot next;

        QueueIterator(BlockingQueue<Slot> queue) {
            this.queue = queue;
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                try {
                    next = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for the next event", e);
                }
            }
            return next != Slot.END;
        }

        @Override
        public Event next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Event event = next.event();
            next = null;
            return event;
        }
    }

    private static final class SinkThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "Sink-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
