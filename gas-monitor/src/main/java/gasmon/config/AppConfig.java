package gasmon.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Manages application configuration by loading properties from a resource file.
 *
 * This class implements the classic thread-safe Singleton pattern to ensure that
 * configuration is loaded only once and that a single, globally accessible instance
 * is used throughout the application.
 */
public class AppConfig {

    private static final String CONFIG_FILE = "application.properties";
    private static volatile AppConfig instance; // volatile to ensure visibility across threads
    private final Properties properties;

    /**
     * Loads properties from the classpath resource defined by {@code CONFIG_FILE}.
     *
     * @throws IllegalStateException if the configuration file cannot be found or loaded.
     */
    private AppConfig() {
        this(loadFromClasspath());
    }

    /**
     * Creates a configuration backed by the given properties.
     */
    AppConfig(Properties properties) {
        this.properties = properties;
    }

    private static Properties loadFromClasspath() {
        Properties properties = new Properties();
        try (InputStream inputStream = AppConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (inputStream == null) {
                throw new IOException("Configuration file '" + CONFIG_FILE + "' not found in the classpath.");
            }
            properties.load(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from classpath resource: " + CONFIG_FILE, e);
        }
        return properties;
    }

    /**
     * Provides global, thread-safe access to the singleton instance of {@code AppConfig}.
     * The instance is created on the first call (lazy initialization).
     *
     * @return The single instance of {@code AppConfig}.
     */
    public static AppConfig getInstance() {
        // Double-Checked Locking for lazy initialization in a multithreaded environment.
        if (instance == null) {
            synchronized (AppConfig.class) {
                if (instance == null) {
                    instance = new AppConfig();
                }
            }
        }
        return instance;
    }

    // --- PIPELINE ---

    /** @return How long events are processed, from "run.time.seconds", or 60 if not specified. */
    public int getRunTimeSeconds() {
        return getInt("run.time.seconds", 60);
    }

    /** @return The URL of the known-location list, from the required "locations.url" property. */
    public String getLocationsUrl() {
        String url = properties.getProperty("locations.url");
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("Missing required configuration property 'locations.url'.");
        }
        return url.trim();
    }

    /** @return The deduplication time to live, from "deduplicator.cache.ttl.seconds", or 60 if not specified. */
    public int getDeduplicationTtlSeconds() {
        return getInt("deduplicator.cache.ttl.seconds", 60);
    }

    /** @return The width of an averaging bin, from "averager.period.seconds", or 60 if not specified. */
    public int getAveragingPeriodSeconds() {
        return getInt("averager.period.seconds", 60);
    }

    /** @return How long a bin is kept open past its end, from "averager.expiry.seconds", or 300 if not specified. */
    public int getAveragingExpirySeconds() {
        return getInt("averager.expiry.seconds", 300);
    }

    // --- MQTT ---

    public String getMqttBrokerUrl() {
        return properties.getProperty("mqtt.broker.url", "tcp://localhost:1883");
    }

    public String getEventTopic() {
        return properties.getProperty("mqtt.topic.events", "gasmon/events");
    }

    public String getMqttClientId() {
        return properties.getProperty("mqtt.client.id", "gasmon-");
    }

    public int getMqttQos() {
        return getInt("mqtt.qos", 1);
    }

    // --- OUTPUT ---

    public String getAveragesFile() {
        return properties.getProperty("output.averages.file", "Gas_Averages.csv");
    }

    public String getLocationFile() {
        return properties.getProperty("output.location.file", "Gas_Location.csv");
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration property '" + key + "' must be an integer. Received: " + value, e);
        }
    }
}
