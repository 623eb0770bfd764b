package gasmon.rest;

import gasmon.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A client for the HTTP endpoint that serves the list of known sensor locations.
 * The endpoint returns a JSON array of {@code {"id": ..., "x": ..., "y": ...}} objects.
 */
public final class LocationClient {

    private static final Logger logger = LoggerFactory.getLogger(LocationClient.class);

    private final String locationsUrl;
    private final RestTemplate restTemplate;

    /**
     * Constructs a client for the locations endpoint.
     *
     * @param locationsUrl The full URL of the location list. Must not be null.
     */
    public LocationClient(String locationsUrl) {
        this(locationsUrl, new RestTemplate());
    }

    /**
     * Constructs a client that uses the given {@link RestTemplate}.
     *
     * @param locationsUrl The full URL of the location list. Must not be null.
     * @param restTemplate The template used for the HTTP call. Must not be null.
     */
    public LocationClient(String locationsUrl, RestTemplate restTemplate) {
        this.locationsUrl = Objects.requireNonNull(locationsUrl, "Locations URL cannot be null");
        this.restTemplate = Objects.requireNonNull(restTemplate, "RestTemplate cannot be null");
    }

    /**
     * Downloads the list of known locations.
     * Entries with a missing or blank id are skipped with a warning.
     *
     * @return The known locations, never empty.
     * @throws LocationLookupException if the endpoint cannot be reached, answers with an error status,
     *                                 or returns no usable location.
     */
    public List<Location> fetchLocations() throws LocationLookupException {
        logger.info("Fetching known locations from {}", locationsUrl);

        ResponseEntity<LocationEntry[]> response;
        try {
            response = restTemplate.exchange(locationsUrl, HttpMethod.GET, createRequestEntity(), LocationEntry[].class);
        } catch (HttpStatusCodeException e) {
            logger.error("Location request to {} failed with HTTP error: {} {}", locationsUrl, e.getStatusCode(), e.getStatusText());
            throw new LocationLookupException("Location list request failed with status " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            logger.error("Failed to fetch locations from {} due to a communication error.", locationsUrl, e);
            throw new LocationLookupException("Could not retrieve location list from " + locationsUrl, e);
        }

        LocationEntry[] body = response.getBody();
        if (body == null) {
            throw new LocationLookupException("Location list response from " + locationsUrl + " had no body.");
        }

        List<Location> locations = new ArrayList<>(body.length);
        for (LocationEntry entry : Arrays.asList(body)) {
            if (entry == null || entry.id() == null || entry.id().isBlank()) {
                logger.warn("Skipping location entry without an id: {}", entry);
                continue;
            }
            locations.add(new Location(entry.id(), entry.x(), entry.y()));
        }

        if (locations.isEmpty()) {
            throw new LocationLookupException("Location list from " + locationsUrl + " contained no usable locations.");
        }
        logger.info("Retrieved {} known locations.", locations.size());
        return List.copyOf(locations);
    }

    private HttpEntity<Void> createRequestEntity() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return new HttpEntity<>(headers);
    }

    /**
     * Wire shape of a single location entry. Kept separate from {@link Location} so that
     * malformed entries can be skipped instead of failing the whole list.
     */
    record LocationEntry(String id, double x, double y) {
    }
}
