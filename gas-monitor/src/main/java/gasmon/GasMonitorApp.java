package gasmon;

import gasmon.config.AppConfig;
import gasmon.mqtt.EventSubscriber;
import gasmon.output.AverageRow;
import gasmon.output.CentroidRow;
import gasmon.output.CsvResultWriter;
import gasmon.rest.LocationClient;
import gasmon.rest.LocationLookupException;
import gasmon.sink.SinkException;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Entry point: fetches the known locations, subscribes to the event topic and runs the pipeline
 * for the configured time, then prints the run summary.
 */
public class GasMonitorApp {
    private static final Logger logger = LoggerFactory.getLogger(GasMonitorApp.class);

    /** Grace period after the run time before the subscription is closed on a quiet topic. */
    private static final int CLOSE_GRACE_SECONDS = 1;

    public static void main(String[] args) {
        AppConfig config = AppConfig.getInstance();
        PipelineSettings settings = PipelineSettings.from(config);

        List<Location> locations;
        try {
            locations = new LocationClient(config.getLocationsUrl()).fetchLocations();
        } catch (LocationLookupException e) {
            logger.error("FATAL STARTUP ERROR: could not load known locations: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        int exitCode = 0;
        ScheduledExecutorService closer = Executors.newSingleThreadScheduledExecutor();
        try (CsvResultWriter<Average, AverageRow> averages = new CsvResultWriter<>(Path.of(config.getAveragesFile()), AverageRow.class, AverageRow::of);
             CsvResultWriter<Centroid, CentroidRow> centroid = new CsvResultWriter<>(Path.of(config.getLocationFile()), CentroidRow.class, CentroidRow::of);
             EventSubscriber subscriber = new EventSubscriber(config.getMqttBrokerUrl(), config.getMqttClientId(),
                     config.getEventTopic(), config.getMqttQos())) {

            GasMonitor monitor = new GasMonitor(locations, settings, averages, centroid);
            subscriber.start();
            closer.schedule(subscriber::close, settings.runTimeSeconds() + CLOSE_GRACE_SECONDS, TimeUnit.SECONDS);

            try {
                monitor.run(subscriber.events());
            } catch (SinkException e) {
                logger.error("Aggregation failed: {}", e.getMessage(), e);
                exitCode = 1;
            }

            System.out.println();
            System.out.println(monitor.summary());
            if (subscriber.getMalformedMessages() > 0) {
                logger.warn("{} malformed messages were dropped by the receiver.", subscriber.getMalformedMessages());
            }
        } catch (MqttException e) {
            logger.error("FATAL STARTUP ERROR: could not subscribe to {}: {}", config.getEventTopic(), e.getMessage(), e);
            exitCode = 1;
        } catch (IOException e) {
            logger.error("Could not open or close an output file: {}", e.getMessage(), e);
            exitCode = 1;
        } finally {
            closer.shutdownNow();
        }

        logger.info("GasMon shut down.");
        System.exit(exitCode);
    }
}
