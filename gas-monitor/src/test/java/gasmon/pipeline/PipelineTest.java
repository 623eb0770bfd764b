package gasmon.pipeline;

import gasmon.Event;
import gasmon.sink.Sink;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class PipelineTest {

    /** Keeps events whose value is not divisible by the given number. */
    private static Stage dropMultiplesOf(int divisor) {
        return events -> new AbstractEventIterator() {
            @Override
            protected Event computeNext() {
                while (events.hasNext()) {
                    Event event = events.next();
                    if (((int) event.value()) % divisor != 0) {
                        return event;
                    }
                }
                return endOfData();
            }
        };
    }

    private static Stage tag(String suffix) {
        return events -> new AbstractEventIterator() {
            @Override
            protected Event computeNext() {
                if (!events.hasNext()) {
                    return endOfData();
                }
                Event e = events.next();
                return new Event(e.locationId(), e.eventId() + suffix, e.timestamp(), e.value());
            }
        };
    }

    private static List<Event> numbers(int count) {
        return IntStream.rangeClosed(1, count)
                .mapToObj(i -> new Event("loc", String.valueOf(i), i, i))
                .collect(Collectors.toList());
    }

    private static List<String> run(Stage stage, List<Event> input) {
        List<String> ids = new ArrayList<>();
        stage.apply(input.iterator()).forEachRemaining(e -> ids.add(e.eventId()));
        return ids;
    }

    @Test
    void combineAppliesFirstThenSecond() {
        List<String> out = run(tag("-a").combine(tag("-b")), numbers(2));

        assertThat(out).containsExactly("1-a-b", "2-a-b");
    }

    @Test
    void combineIsAssociative() {
        Stage a = dropMultiplesOf(2);
        Stage b = dropMultiplesOf(3);
        Stage c = tag("!");

        List<String> left = run(a.combine(b).combine(c), numbers(20));
        List<String> right = run(a.combine(b.combine(c)), numbers(20));

        assertThat(left).isEqualTo(right).containsExactly("1!", "5!", "7!", "11!", "13!", "17!", "19!");
    }

    @Test
    void sinkReceivesEverySurvivingEventInOrder() throws Exception {
        List<String> received = new ArrayList<>();
        Sink collecting = events -> events.forEachRemaining(e -> received.add(e.eventId()));

        dropMultiplesOf(2).sink(collecting).run(numbers(6).iterator());

        assertThat(received).containsExactly("1", "3", "5");
    }

    @Test
    void stagesPullLazily() {
        List<Integer> pulled = new ArrayList<>();
        Iterator<Event> endless = new Iterator<>() {
            int n = 0;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Event next() {
                n++;
                pulled.add(n);
                return new Event("loc", String.valueOf(n), n, n);
            }
        };

        Iterator<Event> out = dropMultiplesOf(2).combine(tag("")).apply(endless);
        assertThat(pulled).isEmpty();

        out.next();
        out.next();

        assertThat(pulled).containsExactly(1, 2, 3);
    }
}
