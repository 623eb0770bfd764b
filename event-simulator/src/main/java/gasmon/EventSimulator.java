package gasmon;

import gasmon.mqtt.EventPublisher;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates and publishes synthetic sensor events at a fixed rate on a background thread.
 */
public class EventSimulator {
    private static final Logger logger = LoggerFactory.getLogger(EventSimulator.class);

    /** Generator for the synthetic events */
    private final EventGenerator eventGenerator;

    /** Publisher for sending events via MQTT */
    private final EventPublisher eventPublisher;

    /** Pause between two published events */
    private final long publishIntervalMs;

    /** Flag indicating whether the simulator is currently running */
    private volatile boolean running = false;

    private volatile long eventsPublished = 0;

    /** Background thread that handles the publishing loop */
    private Thread simulatorThread;

    public EventSimulator(EventGenerator eventGenerator, EventPublisher eventPublisher, int eventsPerSecond) {
        if (eventsPerSecond <= 0) {
            throw new IllegalArgumentException("Events per second must be positive. Received: " + eventsPerSecond);
        }
        this.eventGenerator = eventGenerator;
        this.eventPublisher = eventPublisher;
        this.publishIntervalMs = Math.max(1, 1000L / eventsPerSecond);
        logger.info("EventSimulator initialized with a publish interval of {} ms", publishIntervalMs);
    }

    /**
     * Connects the publisher and starts publishing events.
     * If the simulator is already running, this method has no effect.
     *
     * @throws MqttException if the publisher cannot connect.
     */
    public void start() throws MqttException {
        if (running) {
            logger.warn("Event simulator is already running - ignoring start request");
            return;
        }

        eventPublisher.connect();
        running = true;

        simulatorThread = new Thread(() -> {
            while (running) {
                try {
                    eventPublisher.publish(eventGenerator.nextEvent());
                    eventsPublished++;
                    Thread.sleep(publishIntervalMs);
                } catch (InterruptedException e) {
                    logger.info("Simulator thread interrupted - stopping gracefully");
                    Thread.currentThread().interrupt();
                    running = false;
                }
            }

            logger.info("Simulator thread stopping after {} events - disconnecting MQTT client", eventsPublished);
            eventPublisher.disconnect();
        }, "EventSimulator-Thread");

        simulatorThread.start();
        logger.info("Event simulator started");
    }

    /**
     * Stops publishing and waits for the background thread to finish.
     * If the simulator is not running, this method has no effect.
     */
    public void stop() {
        if (!running) {
            logger.warn("Event simulator is not running - ignoring stop request");
            return;
        }

        logger.info("Stopping event simulator...");
        running = false;

        if (simulatorThread != null) {
            simulatorThread.interrupt();
            try {
                simulatorThread.join();
            } catch (InterruptedException e) {
                logger.error("Interrupted while waiting for simulator thread to stop", e);
                Thread.currentThread().interrupt();
            }
        }

        logger.info("Event simulator stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public long getEventsPublished() {
        return eventsPublished;
    }
}
