package com.hecsink.transport.okhttp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hecsink.transport.DeliveryCancelledException;
import com.hecsink.transport.DeliveryContext;
import com.hecsink.transport.HecEvent;
import com.hecsink.transport.HecResponse;
import com.hecsink.transport.HecSender;
import com.hecsink.transport.HecTransportSettings;
import com.hecsink.transport.InvalidUrlException;
import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OkHttp-based HEC sender.
 *
 * <p>Every instance owns its {@link OkHttpClient}, so TLS settings of one sender never leak into
 * another living in the same process.
 */
public class OkHttpHecSender implements HecSender {
    private static final Logger log = LoggerFactory.getLogger(OkHttpHecSender.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient client;
    private final HttpUrl endpoint;
    private final String authorization;
    private final ObjectMapper json;

    /**
     * @throws com.hecsink.transport.InvalidSettingsException if token or collector URL is empty
     * @throws InvalidUrlException if the collector URL does not parse
     * @throws com.hecsink.transport.TlsSetupException if verification is on and the key pair cannot be loaded
     */
    public OkHttpHecSender(HecTransportSettings settings) {
        this(settings, new OkHttpClient.Builder());
    }

    OkHttpHecSender(HecTransportSettings settings, OkHttpClient.Builder builder) {
        Objects.requireNonNull(settings, "settings").requireComplete();
        this.endpoint = resolveEndpoint(settings.collectorUrl());
        this.authorization = HecSender.authorization(settings.token());
        this.client = TlsConfigurer.configure(settings, builder).build();
        this.json = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.debug("HEC sender ready for {} (verify={})", endpoint, !settings.insecureSkipVerify());
    }

    static HttpUrl resolveEndpoint(String collectorUrl) {
        HttpUrl parsed = HttpUrl.parse(collectorUrl.trim());
        if (parsed == null) throw new InvalidUrlException(collectorUrl);
        return parsed.newBuilder().encodedPath(COLLECTOR_PATH).build();
    }

    @Override
    public HecResponse send(DeliveryContext ctx, Map<String, Object> event, Instant timestamp) throws IOException {
        Objects.requireNonNull(ctx, "ctx");
        ctx.throwIfCancelled();

        byte[] body;
        try {
            body = json.writeValueAsBytes(HecEvent.of(event, timestamp));
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to serialize HEC event", e);
        }
        Request req = new Request.Builder()
                .url(endpoint)
                .header(AUTH_HEADER, authorization)
                .post(RequestBody.create(body, JSON))
                .build();

        Call call = client.newCall(req);
        try (DeliveryContext.Registration cancelHook = ctx.onCancel(call::cancel);
                Response r = call.execute()) {
            String responseBody = r.body() != null ? r.body().string() : "";
            if (log.isDebugEnabled()) {
                log.debug("HEC request {} {} answered {} with body: {}", req.method(), endpoint, r.code(), responseBody);
            }
            return new HecResponse(r.code(), r.message(), responseBody);
        } catch (IOException e) {
            if (ctx.isCancelled()) {
                throw new DeliveryCancelledException(ctx.cause().orElse(DeliveryContext.Cause.CANCELLED), e);
            }
            throw e;
        }
    }

    @Override
    public String endpoint() {
        return endpoint.toString();
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    @Override
    public String toString() {
        return "OkHttpHecSender[" + endpoint + "]";
    }
}
