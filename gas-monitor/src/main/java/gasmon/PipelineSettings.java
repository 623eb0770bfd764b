package gasmon;

import gasmon.config.AppConfig;

/**
 * The tunables of the event pipeline and its sinks.
 *
 * @param runTimeSeconds         How long events are processed.
 * @param deduplicationTtlSeconds How long an event id counts as already seen.
 * @param averagingPeriodSeconds The width of a moving-average bin.
 * @param averagingExpirySeconds How long a bin stays open after its end.
 */
public record PipelineSettings(int runTimeSeconds, int deduplicationTtlSeconds,
                               int averagingPeriodSeconds, int averagingExpirySeconds) {

    public static PipelineSettings from(AppConfig config) {
        return new PipelineSettings(
                config.getRunTimeSeconds(),
                config.getDeduplicationTtlSeconds(),
                config.getAveragingPeriodSeconds(),
                config.getAveragingExpirySeconds());
    }
}
