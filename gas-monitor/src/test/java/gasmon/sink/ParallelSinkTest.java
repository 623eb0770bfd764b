package gasmon.sink;

import gasmon.Event;
import gasmon.Location;
import gasmon.pipeline.DeduplicationStage;
import gasmon.pipeline.LocationFilterStage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelSinkTest {

    private static List<Event> events(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Event(i % 3 == 0 ? "unknown" : "known", "id-" + (i % 10), i, i))
                .collect(Collectors.toList());
    }

    private static Sink collectingInto(List<Event> target) {
        return stream -> stream.forEachRemaining(target::add);
    }

    @Test
    void everySinkSeesEveryEvent() throws Exception {
        List<Event> first = Collections.synchronizedList(new ArrayList<>());
        List<Event> second = Collections.synchronizedList(new ArrayList<>());
        List<Event> input = events(100);

        Sink.parallel(collectingInto(first), collectingInto(second)).handle(input.iterator());

        assertThat(first).containsExactlyElementsOf(input);
        assertThat(second).containsExactlyElementsOf(input);
    }

    @Test
    void upstreamCountersAreNotMultipliedBySinks() throws Exception {
        LocationFilterStage filter = new LocationFilterStage(List.of(new Location("known", 0, 0)));
        DeduplicationStage deduplicator = new DeduplicationStage(3600);
        List<Event> first = Collections.synchronizedList(new ArrayList<>());
        List<Event> second = Collections.synchronizedList(new ArrayList<>());

        filter.combine(deduplicator)
                .sink(Sink.parallel(collectingInto(first), collectingInto(second)))
                .run(events(30).iterator());

        // 10 of 30 sit at multiples of 3; the 20 left carry each of the 10 ids twice.
        assertThat(filter.getInvalidEventsFiltered()).isEqualTo(10);
        assertThat(deduplicator.getDuplicateEventsIgnored()).isEqualTo(10);
        assertThat(first).hasSize(10);
        assertThat(second).containsExactlyElementsOf(first);
    }

    @Test
    void slowSinkDoesNotBlockOthers() throws Exception {
        CountDownLatch fastDone = new CountDownLatch(1);
        List<Event> fast = Collections.synchronizedList(new ArrayList<>());
        List<Event> slow = Collections.synchronizedList(new ArrayList<>());

        Sink fastSink = stream -> {
            stream.forEachRemaining(fast::add);
            fastDone.countDown();
        };
        Sink slowSink = stream -> {
            try {
                // Does not start consuming until the fast sink has seen the whole stream.
                assertThat(fastDone.await(5, TimeUnit.SECONDS)).isTrue();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SinkException("interrupted", e);
            }
            stream.forEachRemaining(slow::add);
        };

        Sink.parallel(fastSink, slowSink).handle(events(50).iterator());

        assertThat(fast).hasSize(50);
        assertThat(slow).hasSize(50);
    }

    @Test
    void failureInOneSinkDoesNotStopTheOther() {
        List<Event> healthy = Collections.synchronizedList(new ArrayList<>());
        Sink failing = stream -> {
            stream.next();
            throw new EmptyAggregateException("nothing to aggregate");
        };

        assertThatThrownBy(() -> Sink.parallel(failing, collectingInto(healthy)).handle(events(20).iterator()))
                .isInstanceOf(EmptyAggregateException.class)
                .hasMessage("nothing to aggregate");
        assertThat(healthy).hasSize(20);
    }

    @Test
    void allFailuresAreReported() {
        Sink first = stream -> {
            throw new SinkException("first");
        };
        Sink second = stream -> {
            throw new IllegalStateException("second");
        };

        assertThatThrownBy(() -> Sink.parallel(first, second).handle(events(5).iterator()))
                .isInstanceOf(SinkException.class)
                .hasMessage("first")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    }
}
