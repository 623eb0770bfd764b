package gasmon.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import gasmon.Centroid;

/**
 * CSV row for the weighted average location.
 */
@JsonPropertyOrder({"x", "y"})
public record CentroidRow(@JsonProperty("x") double x, @JsonProperty("y") double y) {

    public static CentroidRow of(Centroid centroid) {
        return new CentroidRow(centroid.x(), centroid.y());
    }
}
