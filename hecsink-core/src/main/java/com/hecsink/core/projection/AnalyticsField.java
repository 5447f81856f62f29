package com.hecsink.core.projection;

import com.hecsink.core.model.AnalyticsRecord;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed registry of the record fields an event may carry, keyed by their wire name.
 *
 * <p>Declaration order is the order of the default projection.
 */
public enum AnalyticsField {
    METHOD("method", AnalyticsRecord::method),
    PATH("path", AnalyticsRecord::path),
    RESPONSE_CODE("response_code", AnalyticsRecord::responseCode),
    API_KEY("api_key", AnalyticsRecord::apiKey),
    TIME_STAMP("time_stamp", AnalyticsRecord::timeStamp),
    API_VERSION("api_version", AnalyticsRecord::apiVersion),
    API_NAME("api_name", AnalyticsRecord::apiName),
    API_ID("api_id", AnalyticsRecord::apiId),
    ORG_ID("org_id", AnalyticsRecord::orgId),
    OAUTH_ID("oauth_id", AnalyticsRecord::oauthId),
    RAW_REQUEST("raw_request", AnalyticsRecord::rawRequest),
    REQUEST_TIME("request_time", AnalyticsRecord::requestTime),
    RAW_RESPONSE("raw_response", AnalyticsRecord::rawResponse),
    IP_ADDRESS("ip_address", AnalyticsRecord::ipAddress);

    private static final Map<String, AnalyticsField> BY_WIRE_NAME = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(AnalyticsField::wireName, Function.identity())));

    /** Fields emitted when no explicit projection is configured. */
    public static final List<AnalyticsField> DEFAULTS = List.of(values());

    private final String wireName;
    private final Function<AnalyticsRecord, Object> accessor;

    AnalyticsField(String wireName, Function<AnalyticsRecord, Object> accessor) {
        this.wireName = wireName;
        this.accessor = accessor;
    }

    public String wireName() {
        return wireName;
    }

    public Object extract(AnalyticsRecord record) {
        return accessor.apply(record);
    }

    /** Exact, case-sensitive lookup; empty for names outside the registry. */
    public static Optional<AnalyticsField> fromWireName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_WIRE_NAME.get(name));
    }
}
