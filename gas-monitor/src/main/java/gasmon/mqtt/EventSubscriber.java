package gasmon.mqtt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import gasmon.Event;
import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallback;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Subscribes to the MQTT topic carrying sensor events and exposes them as a lazy, blocking stream.
 * <p>
 * Incoming JSON payloads are deserialized into {@link Event} objects on the Paho callback thread
 * and buffered in a queue. {@link #events()} returns an iterator that waits for the next buffered
 * event; the iterator ends once the subscription has been closed and the buffer is drained.
 */
public class EventSubscriber implements MqttCallback, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventSubscriber.class);

    private static final long POLL_INTERVAL_MS = 500;

    private final String brokerUrl;
    private final String clientId;
    private final String topic;
    private final int qos;
    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final BlockingQueue<Event> buffer = new LinkedBlockingQueue<>();

    private MqttClient mqttClient;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong malformedMessages = new AtomicLong();

    /**
     * Constructs a new EventSubscriber.
     *
     * @param brokerUrl The full URI of the MQTT broker (e.g., "tcp://localhost:1883").
     * @param clientId  A base client ID, which will be suffixed to ensure uniqueness.
     * @param topic     The MQTT topic carrying sensor events.
     * @param qos       The quality of service used for the subscription.
     */
    public EventSubscriber(String brokerUrl, String clientId, String topic, int qos) {
        this.brokerUrl = brokerUrl;
        this.clientId = clientId + "_event_subscriber";
        this.topic = topic;
        this.qos = qos;
    }

    /**
     * Connects to the MQTT broker and subscribes to the event topic.
     *
     * @throws MqttException if connecting or subscribing fails.
     */
    public void start() throws MqttException {
        mqttClient = new MqttClient(brokerUrl, clientId, new MemoryPersistence());
        mqttClient.setCallback(this);

        MqttConnectOptions connOpts = new MqttConnectOptions();
        connOpts.setCleanSession(true);
        connOpts.setAutomaticReconnect(true);

        logger.info("EventSubscriber connecting to MQTT broker: {} with client ID: {}", brokerUrl, clientId);
        mqttClient.connect(connOpts);
        logger.info("EventSubscriber connected to MQTT broker.");

        mqttClient.subscribe(topic, qos);
        logger.info("Subscribed to topic '{}' with QoS {}", topic, qos);
    }

    /**
     * Returns the stream of received events. Each call returns a view over the same buffer, so
     * an event is delivered to exactly one of the returned iterators.
     */
    public Iterator<Event> events() {
        return new Iterator<>() {
            private Event next;

            @Override
            public boolean hasNext() {
                while (next == null) {
                    if (closed.get() && buffer.isEmpty()) {
                        return false;
                    }
                    try {
                        next = buffer.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        logger.warn("Interrupted while waiting for events; ending the event stream.");
                        return false;
                    }
                }
                return true;
            }

            @Override
            public Event next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Event event = next;
                next = null;
                return event;
            }
        };
    }

    @Override
    public void messageArrived(String topic, MqttMessage message) {
        String payload = new String(message.getPayload(), StandardCharsets.UTF_8);
        try {
            Event event = objectMapper.readValue(payload, Event.class);
            if (event == null) {
                malformedMessages.incrementAndGet();
                logger.warn("Received event payload which deserialized to null. Payload: {}", payload);
                return;
            }
            buffer.add(event);
        } catch (JsonProcessingException e) {
            malformedMessages.incrementAndGet();
            logger.warn("Dropping malformed event payload on topic '{}': {}", topic, payload);
            logger.debug("Malformed payload cause", e);
        }
    }

    @Override
    public void connectionLost(Throwable cause) {
        logger.error("MQTT connection lost for client '{}'. Automatic reconnect will be attempted. Cause: {}",
                clientId, cause.getMessage(), cause);
    }

    @Override
    public void deliveryComplete(IMqttDeliveryToken token) {
        // Not used for a subscriber-only client.
    }

    /** @return The number of payloads dropped because they could not be parsed. */
    public long getMalformedMessages() {
        return malformedMessages.get();
    }

    /**
     * Stops receiving new events. Events already buffered are still returned by {@link #events()}.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (mqttClient != null && mqttClient.isConnected()) {
                logger.info("Unsubscribing and disconnecting EventSubscriber (client ID: {})", clientId);
                mqttClient.unsubscribe(topic);
                mqttClient.disconnect();
                logger.info("EventSubscriber disconnected successfully.");
            }
        } catch (MqttException e) {
            logger.error("Error during MQTT disconnection for client '{}'", clientId, e);
        } finally {
            try {
                if (mqttClient != null) {
                    mqttClient.close();
                }
            } catch (MqttException e) {
                logger.error("Error closing MQTT client '{}'", clientId, e);
            }
        }
    }
}
