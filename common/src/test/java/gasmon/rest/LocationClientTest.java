package gasmon.rest;

import gasmon.Location;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LocationClientTest {

    private static final String URL = "http://locations.test/locations.json";

    private MockRestServiceServer server;
    private LocationClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new LocationClient(URL, restTemplate);
    }

    @Test
    void parsesLocationList() throws Exception {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[{\"id\":\"a\",\"x\":1.5,\"y\":2.0},{\"id\":\"b\",\"x\":10,\"y\":0}]",
                        MediaType.APPLICATION_JSON));

        assertThat(client.fetchLocations())
                .containsExactly(new Location("a", 1.5, 2.0), new Location("b", 10, 0));
        server.verify();
    }

    @Test
    void skipsEntriesWithoutId() throws Exception {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("[{\"x\":1,\"y\":1},{\"id\":\" \",\"x\":2,\"y\":2},{\"id\":\"c\",\"x\":3,\"y\":4}]",
                        MediaType.APPLICATION_JSON));

        assertThat(client.fetchLocations()).containsExactly(new Location("c", 3, 4));
    }

    @Test
    void emptyListIsAnError() {
        server.expect(requestTo(URL)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchLocations())
                .isInstanceOf(LocationLookupException.class)
                .hasMessageContaining("no usable locations");
    }

    @Test
    void errorStatusIsReported() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.fetchLocations())
                .isInstanceOf(LocationLookupException.class)
                .hasMessageContaining("404");
    }
}
