package com.hecsink.transport.okhttp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hecsink.transport.DeliveryCancelledException;
import com.hecsink.transport.DeliveryContext;
import com.hecsink.transport.HecResponse;
import com.hecsink.transport.HecSender;
import com.hecsink.transport.HecTransportSettings;
import com.hecsink.transport.InvalidSettingsException;
import com.hecsink.transport.InvalidUrlException;
import com.hecsink.transport.TlsSetupException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class OkHttpHecSenderTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockWebServer server;
    private OkHttpHecSender sender;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        sender = new OkHttpHecSender(HecTransportSettings.insecure("tok", server.url("/ignored/path").toString()));
    }

    @AfterEach
    void tearDown() throws Exception {
        sender.close();
        server.shutdown();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "https://h:8088",
        "https://h:8088/",
        "https://h:8088/some/other/path",
        "http://splunk.example.com/services/collector",
        " https://h:8088/raw "
    })
    void endpoint_path_is_always_the_collector_path(String url) {
        try (OkHttpHecSender s = new OkHttpHecSender(HecTransportSettings.insecure("tok", url))) {
            HttpUrl endpoint = HttpUrl.parse(s.endpoint());
            assertThat(endpoint).isNotNull();
            assertThat(endpoint.encodedPath()).isEqualTo(HecSender.COLLECTOR_PATH);
        }
    }

    @Test
    void endpoint_keeps_query_and_port() {
        try (OkHttpHecSender s =
                new OkHttpHecSender(HecTransportSettings.insecure("tok", "https://h:8088/x?channel=abc"))) {
            assertThat(s.endpoint()).isEqualTo("https://h:8088/services/collector/event/1.0?channel=abc");
        }
    }

    @Test
    void empty_token_fails_construction() {
        assertThatThrownBy(() -> new OkHttpHecSender(HecTransportSettings.insecure("", "https://h:8088")))
                .isInstanceOf(InvalidSettingsException.class);
    }

    @Test
    void empty_url_fails_construction() {
        assertThatThrownBy(() -> new OkHttpHecSender(HecTransportSettings.insecure("tok", "")))
                .isInstanceOf(InvalidSettingsException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"not a url", "ftp://h:8088", "https://", "h:8088"})
    void unparseable_url_fails_construction(String url) {
        assertThatThrownBy(() -> new OkHttpHecSender(HecTransportSettings.insecure("tok", url)))
                .isInstanceOf(InvalidUrlException.class)
                .hasMessageContaining(url);
    }

    @Test
    void verification_without_key_pair_fails_construction() {
        HecTransportSettings settings =
                new HecTransportSettings("tok", "https://h:8088", false, "/missing/cert.pem", "/missing/key.pem", "", null);

        assertThatThrownBy(() -> new OkHttpHecSender(settings)).isInstanceOf(TlsSetupException.class);
    }

    @Test
    void verification_with_blank_paths_fails_construction() {
        HecTransportSettings settings = new HecTransportSettings("tok", "https://h:8088", false, "", "", "", null);

        assertThatThrownBy(() -> new OkHttpHecSender(settings))
                .isInstanceOf(TlsSetupException.class)
                .hasMessageContaining("ssl_cert_file");
    }

    @Test
    void posts_envelope_with_splunk_authorization() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"text\":\"Success\",\"code\":0}"));
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("method", "GET");
        event.put("response_code", 200);
        event.put("time_stamp", Instant.parse("2024-03-01T10:15:30Z"));

        HecResponse response = sender.send(DeliveryContext.background(), event, Instant.parse("2024-03-01T10:15:30.750Z"));

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.body()).contains("Success");

        RecordedRequest recorded = server.takeRequest(2, TimeUnit.SECONDS);
        assertThat(recorded).isNotNull();
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getPath()).isEqualTo(HecSender.COLLECTOR_PATH);
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Splunk tok");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");

        JsonNode root = MAPPER.readTree(recorded.getBody().readUtf8());
        assertThat(root.path("time").isIntegralNumber()).isTrue();
        assertThat(root.path("time").asLong()).isEqualTo(1709288130L);
        assertThat(root.path("event").path("method").asText()).isEqualTo("GET");
        assertThat(root.path("event").path("response_code").asInt()).isEqualTo(200);
        assertThat(root.path("event").path("time_stamp").asText()).isEqualTo("2024-03-01T10:15:30Z");
    }

    @Test
    void error_status_is_returned_not_thrown() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("{\"text\":\"Invalid token\",\"code\":4}"));

        HecResponse response = sender.send(DeliveryContext.background(), Map.of("path", "/x"), Instant.now());

        assertThat(response.statusCode()).isEqualTo(403);
        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.body()).contains("Invalid token");
    }

    @Test
    void cancelled_context_sends_nothing() {
        DeliveryContext ctx = DeliveryContext.background();
        ctx.cancel();

        assertThatThrownBy(() -> sender.send(ctx, Map.of("path", "/x"), Instant.now()))
                .isInstanceOf(DeliveryCancelledException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void cancel_aborts_in_flight_request() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        DeliveryContext ctx = DeliveryContext.background();
        ScheduledExecutorService canceller = Executors.newSingleThreadScheduledExecutor();
        try {
            canceller.schedule(ctx::cancel, 200, TimeUnit.MILLISECONDS);

            assertThatThrownBy(() -> sender.send(ctx, Map.of("path", "/x"), Instant.now()))
                    .isInstanceOf(DeliveryCancelledException.class)
                    .satisfies(e -> assertThat(((DeliveryCancelledException) e).isDeadlineExceeded()).isFalse());
        } finally {
            canceller.shutdownNow();
        }
    }

    @Test
    void deadline_aborts_in_flight_request() {
        server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.NO_RESPONSE));
        DeliveryContext ctx = DeliveryContext.withTimeout(Duration.ofMillis(300));

        long started = System.nanoTime();
        assertThatThrownBy(() -> sender.send(ctx, Map.of("path", "/x"), Instant.now()))
                .isInstanceOf(DeliveryCancelledException.class)
                .satisfies(e -> assertThat(((DeliveryCancelledException) e).isDeadlineExceeded()).isTrue());
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void senders_do_not_share_clients() {
        try (OkHttpHecSender other = new OkHttpHecSender(HecTransportSettings.insecure("tok2", "https://other:8088"))) {
            assertThat(other.endpoint()).isNotEqualTo(sender.endpoint());
        }
    }
}
