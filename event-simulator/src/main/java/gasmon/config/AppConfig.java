package gasmon.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Configuration manager for loading and accessing application properties.
 */
public class AppConfig {

    private static final String CONFIG_FILE = "application.properties";
    private static AppConfig instance;
    private final Properties properties;

    /**
     * Private constructor that loads configuration from application.properties.
     *
     * @throws IllegalStateException if configuration file cannot be found or loaded
     */
    private AppConfig() {
        properties = new Properties();
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                throw new IOException("Configuration file '" + CONFIG_FILE + "' not found in the classpath.");
            }
            properties.load(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration file: " + CONFIG_FILE, e);
        }
    }

    /**
     * Gets the singleton instance of the AppConfig.
     *
     * @return The single instance of AppConfig.
     */
    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig();
        }
        return instance;
    }

    /**
     * Gets the URL of the known-location list.
     *
     * @return Locations URL
     * @throws IllegalStateException if the property is missing
     */
    public String getLocationsUrl() {
        String url = properties.getProperty("locations.url");
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("Missing required configuration property 'locations.url'.");
        }
        return url.trim();
    }

    // --- MQTT Configuration ---

    public String getMqttBrokerUrl() {
        return properties.getProperty("mqtt.broker.url", "tcp://localhost:1883");
    }

    public String getEventTopic() {
        return properties.getProperty("mqtt.topic.events", "gasmon/events");
    }

    /**
     * Gets the MQTT Quality of Service level.
     *
     * @return MQTT QoS level, defaults to 1 if not specified
     */
    public int getMqttQos() {
        return Integer.parseInt(properties.getProperty("mqtt.qos", "1"));
    }

    public String getMqttClientIdPrefix() {
        return properties.getProperty("mqtt.client.id", "EventSimulator-");
    }

    // --- Simulation ---

    public int getEventsPerSecond() {
        return Integer.parseInt(properties.getProperty("simulator.events.per.second", "20"));
    }

    /**
     * @return Share of events re-sent with the previous event's id, defaults to 0.1
     */
    public double getDuplicateRatio() {
        return Double.parseDouble(properties.getProperty("simulator.duplicate.ratio", "0.1"));
    }

    /**
     * @return Share of events reported for an unknown location, defaults to 0.05
     */
    public double getInvalidLocationRatio() {
        return Double.parseDouble(properties.getProperty("simulator.invalid.location.ratio", "0.05"));
    }
}
