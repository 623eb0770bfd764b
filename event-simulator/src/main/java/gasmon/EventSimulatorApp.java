package gasmon;

import gasmon.config.AppConfig;
import gasmon.mqtt.EventPublisher;
import gasmon.rest.LocationClient;
import gasmon.rest.LocationLookupException;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Scanner;

public class EventSimulatorApp {
    private static final Logger logger = LoggerFactory.getLogger(EventSimulatorApp.class);

    public static void main(String[] args) {
        logger.info("Starting Event Simulator...");
        AppConfig config = AppConfig.getInstance();

        List<Location> locations;
        try {
            locations = new LocationClient(config.getLocationsUrl()).fetchLocations();
        } catch (LocationLookupException e) {
            logger.error("Could not load known locations: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        EventGenerator generator = new EventGenerator(locations, config.getDuplicateRatio(), config.getInvalidLocationRatio());
        EventPublisher publisher = new EventPublisher(config.getMqttBrokerUrl(), config.getEventTopic(),
                config.getMqttQos(), config.getMqttClientIdPrefix());
        EventSimulator simulator = new EventSimulator(generator, publisher, config.getEventsPerSecond());

        try {
            simulator.start();
        } catch (MqttException e) {
            logger.error("Could not connect to MQTT broker {}: {}", config.getMqttBrokerUrl(), e.getMessage(), e);
            System.exit(1);
            return;
        }

        // Stop cleanly if the JVM is terminated
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (simulator.isRunning()) {
                logger.info("Shutdown hook triggered. Stopping event simulator...");
                simulator.stop();
            }
        }));

        Scanner scanner = new Scanner(System.in);
        logger.info("Press ENTER to stop the application...");
        scanner.nextLine();
        scanner.close();

        if (simulator.isRunning()) {
            simulator.stop();
        }
        logger.info("Event Simulator finished after publishing {} events.", simulator.getEventsPublished());
    }
}
