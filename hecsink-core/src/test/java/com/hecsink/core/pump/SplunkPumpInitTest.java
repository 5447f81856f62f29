package com.hecsink.core.pump;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hecsink.core.model.AnalyticsRecordFixtures;
import com.hecsink.transport.DeliveryContext;
import com.hecsink.transport.InvalidSettingsException;
import com.hecsink.transport.InvalidUrlException;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Runs the pump end to end against a local collector, with the transport found on the class path. */
class SplunkPumpInitTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void init_builds_a_working_pump() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"text\":\"Success\",\"code\":0}"));

        try (SplunkPump pump = SplunkPump.init(Map.of(
                "collector_token", "tok",
                "collector_url", server.url("/").toString(),
                "ssl_insecure_skip_verify", true,
                "fields", List.of("method", "path", "api_key"),
                "obfuscate_api_keys", true,
                "obfuscate_api_keys_length", 4))) {

            assertThat(pump.endpoint()).endsWith("/services/collector/event/1.0");
            DeliveryReport report =
                    pump.writeData(DeliveryContext.background(), List.of(AnalyticsRecordFixtures.sample()));
            assertThat(report.delivered()).isEqualTo(1);
        }

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/services/collector/event/1.0");
        assertThat(request.getHeader("authorization")).isEqualTo("Splunk tok");
        JsonNode body = MAPPER.readTree(request.getBody().readUtf8());
        assertThat(body.get("time").asLong()).isEqualTo(AnalyticsRecordFixtures.TS.getEpochSecond());
        assertThat(body.get("event").get("method").asText()).isEqualTo("GET");
        assertThat(body.get("event").get("path").asText()).isEqualTo("/x");
        assertThat(body.get("event").get("api_key").asText()).isEqualTo("****7890");
        assertThat(body.get("event").size()).isEqualTo(3);
    }

    @Test
    void init_rejects_missing_token() {
        assertThatThrownBy(() -> SplunkPump.init(Map.of("collector_url", server.url("/").toString())))
                .isInstanceOf(InvalidSettingsException.class);
    }

    @Test
    void init_rejects_unparseable_url() {
        assertThatThrownBy(() -> SplunkPump.init(Map.of(
                        "collector_token", "tok",
                        "collector_url", "not a url",
                        "ssl_insecure_skip_verify", true)))
                .isInstanceOf(InvalidUrlException.class);
    }
}
