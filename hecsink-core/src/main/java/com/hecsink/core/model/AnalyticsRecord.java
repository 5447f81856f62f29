package com.hecsink.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One analytics entry handed over by the record source. Immutable; build with {@link #builder()}.
 */
public final class AnalyticsRecord {
    private final String method;
    private final String path;
    private final int responseCode;
    private final String apiKey;
    private final Instant timeStamp;
    private final String apiVersion;
    private final String apiName;
    private final String apiId;
    private final String orgId;
    private final String oauthId;
    private final String rawRequest;
    private final String rawResponse;
    private final long requestTime; // milliseconds
    private final String ipAddress;

    private AnalyticsRecord(Builder b) {
        this.method = b.method;
        this.path = b.path;
        this.responseCode = b.responseCode;
        this.apiKey = b.apiKey;
        this.timeStamp = b.timeStamp;
        this.apiVersion = b.apiVersion;
        this.apiName = b.apiName;
        this.apiId = b.apiId;
        this.orgId = b.orgId;
        this.oauthId = b.oauthId;
        this.rawRequest = b.rawRequest;
        this.rawResponse = b.rawResponse;
        this.requestTime = b.requestTime;
        this.ipAddress = b.ipAddress;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public int responseCode() {
        return responseCode;
    }

    public String apiKey() {
        return apiKey;
    }

    public Instant timeStamp() {
        return timeStamp;
    }

    public String apiVersion() {
        return apiVersion;
    }

    public String apiName() {
        return apiName;
    }

    public String apiId() {
        return apiId;
    }

    public String orgId() {
        return orgId;
    }

    public String oauthId() {
        return oauthId;
    }

    public String rawRequest() {
        return rawRequest;
    }

    public String rawResponse() {
        return rawResponse;
    }

    public long requestTime() {
        return requestTime;
    }

    public String ipAddress() {
        return ipAddress;
    }

    public Builder toBuilder() {
        return new Builder()
                .method(method)
                .path(path)
                .responseCode(responseCode)
                .apiKey(apiKey)
                .timeStamp(timeStamp)
                .apiVersion(apiVersion)
                .apiName(apiName)
                .apiId(apiId)
                .orgId(orgId)
                .oauthId(oauthId)
                .rawRequest(rawRequest)
                .rawResponse(rawResponse)
                .requestTime(requestTime)
                .ipAddress(ipAddress);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalyticsRecord other)) return false;
        return responseCode == other.responseCode
                && requestTime == other.requestTime
                && Objects.equals(method, other.method)
                && Objects.equals(path, other.path)
                && Objects.equals(apiKey, other.apiKey)
                && Objects.equals(timeStamp, other.timeStamp)
                && Objects.equals(apiVersion, other.apiVersion)
                && Objects.equals(apiName, other.apiName)
                && Objects.equals(apiId, other.apiId)
                && Objects.equals(orgId, other.orgId)
                && Objects.equals(oauthId, other.oauthId)
                && Objects.equals(rawRequest, other.rawRequest)
                && Objects.equals(rawResponse, other.rawResponse)
                && Objects.equals(ipAddress, other.ipAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, responseCode, apiKey, timeStamp, apiId, orgId, requestTime);
    }

    // api key and raw payloads stay out of toString
    @Override
    public String toString() {
        return "AnalyticsRecord[" + method + " " + path + " -> " + responseCode + ", apiId=" + apiId
                + ", orgId=" + orgId + ", timeStamp=" + timeStamp + "]";
    }

    // ---- Builder ----
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String method;
        private String path;
        private int responseCode;
        private String apiKey;
        private Instant timeStamp;
        private String apiVersion;
        private String apiName;
        private String apiId;
        private String orgId;
        private String oauthId;
        private String rawRequest;
        private String rawResponse;
        private long requestTime;
        private String ipAddress;

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder responseCode(int responseCode) {
            this.responseCode = responseCode;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeStamp(Instant timeStamp) {
            this.timeStamp = timeStamp;
            return this;
        }

        public Builder apiVersion(String apiVersion) {
            this.apiVersion = apiVersion;
            return this;
        }

        public Builder apiName(String apiName) {
            this.apiName = apiName;
            return this;
        }

        public Builder apiId(String apiId) {
            this.apiId = apiId;
            return this;
        }

        public Builder orgId(String orgId) {
            this.orgId = orgId;
            return this;
        }

        public Builder oauthId(String oauthId) {
            this.oauthId = oauthId;
            return this;
        }

        public Builder rawRequest(String rawRequest) {
            this.rawRequest = rawRequest;
            return this;
        }

        public Builder rawResponse(String rawResponse) {
            this.rawResponse = rawResponse;
            return this;
        }

        public Builder requestTime(long requestTime) {
            this.requestTime = requestTime;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public AnalyticsRecord build() {
            return new AnalyticsRecord(this);
        }
    }
}
