package gasmon.mqtt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import gasmon.Event;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Publishes {@link Event} messages as JSON to an MQTT topic.
 */
public class EventPublisher {

	private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

	private final String brokerUrl;
	private final String topic;
	private final int qos;
	private final String clientIdPrefix;
	private final ObjectMapper objectMapper = new ObjectMapper();

	private MqttClient client;

	/**
	 * @param brokerUrl      The full URI of the MQTT broker (e.g., "tcp://localhost:1883").
	 * @param topic          The topic events are published to.
	 * @param qos            The quality of service for every message.
	 * @param clientIdPrefix Prefix of the generated client identifier.
	 */
	public EventPublisher(String brokerUrl, String topic, int qos, String clientIdPrefix) {
		this.brokerUrl = brokerUrl;
		this.topic = topic;
		this.qos = qos;
		this.clientIdPrefix = clientIdPrefix;
	}

	/**
	 * Connects to the MQTT broker.
	 *
	 * @throws MqttException if the connection cannot be established.
	 */
	public void connect() throws MqttException {
		String uniqueClientId = clientIdPrefix + MqttClient.generateClientId();
		client = new MqttClient(brokerUrl, uniqueClientId, new MemoryPersistence());

		MqttConnectOptions connectionOptions = new MqttConnectOptions();
		connectionOptions.setCleanSession(true);
		connectionOptions.setAutomaticReconnect(true);

		logger.info("Connecting to MQTT broker at {} with client ID '{}'", brokerUrl, uniqueClientId);
		client.connect(connectionOptions);
		logger.info("Successfully connected to MQTT broker.");
	}

	/**
	 * Serializes an event to JSON.
	 */
	String toPayload(Event event) throws JsonProcessingException {
		return objectMapper.writeValueAsString(event);
	}

	/**
	 * Serializes an event to JSON and publishes it to the configured topic.
	 * Failures are logged; the caller keeps publishing.
	 *
	 * @param event The event to publish.
	 */
	public void publish(Event event) {
		if (client == null || !client.isConnected()) {
			logger.warn("MQTT client is not connected; cannot publish event {}.", event.eventId());
			return;
		}

		try {
			MqttMessage mqttMessage = new MqttMessage(toPayload(event).getBytes(StandardCharsets.UTF_8));
			mqttMessage.setQos(qos);

			client.publish(topic, mqttMessage);
			logger.debug("Published event to topic '{}': {}", topic, event);
		} catch (JsonProcessingException e) {
			logger.error("Error serializing event {}", event.eventId(), e);
		} catch (MqttException e) {
			logger.error("Error publishing event {} to topic '{}'. Cause: {}", event.eventId(), topic, e.getMessage(), e);
		}
	}

	/** @return Whether the publisher currently holds a live broker connection. */
	public boolean isConnected() {
		return client != null && client.isConnected();
	}

	/**
	 * Cleanly disconnects from the MQTT broker and releases client resources.
	 */
	public void disconnect() {
		if (client == null) {
			return;
		}
		try {
			if (client.isConnected()) {
				client.disconnect();
				logger.info("Disconnected from MQTT broker at {}.", brokerUrl);
			}
		} catch (MqttException e) {
			logger.error("Error while disconnecting from MQTT broker at {}: {}", brokerUrl, e.getMessage(), e);
		} finally {
			try {
				client.close();
			} catch (MqttException e) {
				logger.error("Error closing MQTT client for {}", brokerUrl, e);
			}
		}
	}
}
