package gasmon;

import gasmon.output.ResultWriter;
import gasmon.pipeline.BoundedDurationStage;
import gasmon.pipeline.DeduplicationStage;
import gasmon.pipeline.LocationFilterStage;
import gasmon.pipeline.Pipeline;
import gasmon.sink.Sink;
import gasmon.sink.SinkException;
import gasmon.sink.SpatialAverager;
import gasmon.sink.WindowedAverager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Wires the event pipeline for one bounded run: events are limited to the run time, filtered to
 * known locations and deduplicated, then fed in a single pass to both the moving averager and the
 * weighted location averager.
 */
public class GasMonitor {
    private static final Logger logger = LoggerFactory.getLogger(GasMonitor.class);

    private final BoundedDurationStage boundedDuration;
    private final LocationFilterStage locationFilter;
    private final DeduplicationStage deduplicator;
    private final WindowedAverager windowedAverager;
    private final SpatialAverager spatialAverager;
    private final Pipeline pipeline;

    public GasMonitor(List<Location> locations, PipelineSettings settings,
                      ResultWriter<Average> averageWriter, ResultWriter<Centroid> centroidWriter) {
        this(locations, settings, averageWriter, centroidWriter, Clock.systemUTC());
    }

    public GasMonitor(List<Location> locations, PipelineSettings settings,
                      ResultWriter<Average> averageWriter, ResultWriter<Centroid> centroidWriter, Clock clock) {
        Objects.requireNonNull(locations, "Locations cannot be null.");
        Objects.requireNonNull(settings, "Settings cannot be null.");

        this.boundedDuration = new BoundedDurationStage(settings.runTimeSeconds(), clock);
        this.locationFilter = new LocationFilterStage(locations);
        this.deduplicator = new DeduplicationStage(settings.deduplicationTtlSeconds(), clock);
        this.windowedAverager = new WindowedAverager(settings.averagingPeriodSeconds(),
                settings.averagingExpirySeconds(), averageWriter, clock);
        this.spatialAverager = new SpatialAverager(locations, centroidWriter);

        this.pipeline = boundedDuration
                .combine(locationFilter)
                .combine(deduplicator)
                .sink(Sink.parallel(windowedAverager, spatialAverager));

        logger.info("Initialized pipeline for {} known locations: {}", locations.size(), settings);
    }

    /**
     * Processes events from the given source until the run time is over or the source ends.
     *
     * @param source the raw event stream
     * @return the run counters
     * @throws SinkException if either sink failed; the counters are still available from {@link #summary()}
     */
    public RunSummary run(Iterator<Event> source) throws SinkException {
        pipeline.run(source);
        RunSummary summary = summary();
        logger.info("Run complete. {} events processed, {} invalid, {} duplicates.",
                summary.eventsProcessed(), summary.invalidLocations(), summary.duplicates());
        return summary;
    }

    public RunSummary summary() {
        return new RunSummary(
                boundedDuration.getEventsProcessed(),
                boundedDuration.getRunTimeSeconds(),
                locationFilter.getInvalidEventsFiltered(),
                deduplicator.getDuplicateEventsIgnored());
    }

    public WindowedAverager getWindowedAverager() {
        return windowedAverager;
    }

    public SpatialAverager getSpatialAverager() {
        return spatialAverager;
    }
}
