package gasmon.mqtt;

import gasmon.Event;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EventSubscriberTest {

    private final EventSubscriber subscriber = new EventSubscriber("tcp://localhost:1883", "test", "test/events", 1);

    private void deliver(String json) {
        subscriber.messageArrived("test/events", new MqttMessage(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void parsesEventsInArrivalOrder() {
        deliver("{\"locationId\":\"loc-1\",\"eventId\":\"e-1\",\"timestamp\":1000,\"value\":1.5}");
        deliver("{\"locationId\":\"loc-2\",\"eventId\":\"e-2\",\"timestamp\":2000,\"value\":2.5,\"extra\":true}");
        subscriber.close();

        List<Event> events = new ArrayList<>();
        subscriber.events().forEachRemaining(events::add);

        assertThat(events).containsExactly(
                new Event("loc-1", "e-1", 1000, 1.5),
                new Event("loc-2", "e-2", 2000, 2.5));
    }

    @Test
    void dropsMalformedPayloads() {
        deliver("not json");
        deliver("{\"locationId\":\"loc-1\",\"timestamp\":1000,\"value\":1.5}");
        deliver("{\"locationId\":\"loc-1\",\"eventId\":\"ok\",\"timestamp\":1000,\"value\":1.5}");
        subscriber.close();

        List<Event> events = new ArrayList<>();
        subscriber.events().forEachRemaining(events::add);

        assertThat(events).extracting(Event::eventId).containsExactly("ok");
        assertThat(subscriber.getMalformedMessages()).isEqualTo(2);
    }

    @Test
    void streamWaitsForEventsUntilClosed() throws Exception {
        Iterator<Event> events = subscriber.events();
        Thread producer = new Thread(() -> {
            deliver("{\"locationId\":\"loc\",\"eventId\":\"late\",\"timestamp\":1,\"value\":1}");
            subscriber.close();
        });

        producer.start();
        assertThat(events.hasNext()).isTrue();
        assertThat(events.next().eventId()).isEqualTo("late");
        producer.join();
        assertThat(events.hasNext()).isFalse();
    }

    @Test
    void closeFromSeveralThreadsAtOnceIsSafe() throws Exception {
        deliver("{\"locationId\":\"loc\",\"eventId\":\"kept\",\"timestamp\":1,\"value\":1}");
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> closers = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                closers.add(pool.submit(() -> {
                    go.await();
                    subscriber.close();
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> closer : closers) {
                closer.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<Event> events = new ArrayList<>();
        subscriber.events().forEachRemaining(events::add);
        assertThat(events).extracting(Event::eventId).containsExactly("kept");
    }
}
