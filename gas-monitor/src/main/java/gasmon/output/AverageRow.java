package gasmon.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import gasmon.Average;

import java.time.Instant;

/**
 * CSV row for a finalised bin average. Bin bounds are written as ISO-8601 instants.
 */
@JsonPropertyOrder({"Bin Start", "Bin End", "Average Value"})
public record AverageRow(
        @JsonProperty("Bin Start") String binStart,
        @JsonProperty("Bin End") String binEnd,
        @JsonProperty("Average Value") double averageValue) {

    public static AverageRow of(Average average) {
        return new AverageRow(
                Instant.ofEpochMilli(average.start()).toString(),
                Instant.ofEpochMilli(average.end()).toString(),
                average.value());
    }
}
