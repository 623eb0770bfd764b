package gasmon.mqtt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import gasmon.Event;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class EventPublisherTest {

    @Test
    void payloadCarriesAllEventFields() throws Exception {
        EventPublisher publisher = new EventPublisher("tcp://localhost:1883", "test/events", 1, "test-");

        JsonNode json = new ObjectMapper().readTree(publisher.toPayload(new Event("loc-1", "e-1", 1234L, 2.5)));

        assertThat(json.get("locationId").asText()).isEqualTo("loc-1");
        assertThat(json.get("eventId").asText()).isEqualTo("e-1");
        assertThat(json.get("timestamp").asLong()).isEqualTo(1234L);
        assertThat(json.get("value").asDouble()).isEqualTo(2.5);
    }

    @Test
    void publishingWithoutConnectionIsSkipped() {
        EventPublisher publisher = new EventPublisher("tcp://localhost:1883", "test/events", 1, "test-");

        assertThatCode(() -> publisher.publish(new Event("loc-1", "e-1", 1234L, 2.5)))
                .doesNotThrowAnyException();
        assertThat(publisher.isConnected()).isFalse();
        assertThatCode(publisher::disconnect).doesNotThrowAnyException();
        assertThat(publisher.isConnected()).isFalse();
    }
}
