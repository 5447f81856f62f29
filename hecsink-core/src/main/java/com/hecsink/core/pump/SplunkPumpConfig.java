package com.hecsink.core.pump;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.hecsink.core.projection.ProjectionConfig;
import com.hecsink.transport.HecTransportSettings;
import com.hecsink.transport.InvalidSettingsException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Settings of a {@link SplunkPump}, keyed the way the host's pump configuration names them
 * ({@code collector_token}, {@code ssl_cert_file}, ...).
 */
public class SplunkPumpConfig {
    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    @JsonProperty("collector_token")
    private String collectorToken;

    @JsonProperty("collector_url")
    private String collectorUrl;

    @JsonProperty("ssl_insecure_skip_verify")
    private boolean sslInsecureSkipVerify;

    @JsonProperty("ssl_cert_file")
    private String sslCertFile;

    @JsonProperty("ssl_key_file")
    private String sslKeyFile;

    @JsonProperty("ssl_server_name")
    private String sslServerName;

    @JsonProperty("ssl_ca_file")
    private String sslCaFile;

    @JsonProperty("obfuscate_api_keys")
    private boolean obfuscateApiKeys;

    @JsonProperty("obfuscate_api_keys_length")
    private int obfuscateApiKeysLength;

    @JsonProperty("fields")
    private List<String> fields = new ArrayList<>();

    @JsonProperty("delivery_policy")
    private DeliveryPolicy deliveryPolicy = DeliveryPolicy.FIRE_AND_FORGET;

    @JsonProperty("fail_on_http_error")
    private boolean failOnHttpError;

    @JsonProperty("max_concurrency")
    private int maxConcurrency = 1;

    /** Per-batch deadline in seconds; 0 leaves the caller's context untouched. */
    @JsonProperty("timeout")
    private int timeout;

    /**
     * Decodes a loosely typed pump configuration. Unknown keys are ignored.
     *
     * @throws InvalidSettingsException if a value has the wrong type
     */
    public static SplunkPumpConfig fromMap(Map<String, ?> raw) {
        if (raw == null) return new SplunkPumpConfig();
        try {
            return MAPPER.convertValue(raw, SplunkPumpConfig.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidSettingsException("Cannot decode Splunk pump configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Checks the invariants that do not need the network. Token/URL presence and TLS material are
     * checked again by the transport.
     */
    public SplunkPumpConfig validate() {
        toTransportSettings().requireComplete();
        if (maxConcurrency < 1) {
            throw new InvalidSettingsException("max_concurrency must be at least 1: " + maxConcurrency);
        }
        if (timeout < 0) {
            throw new InvalidSettingsException("timeout must not be negative: " + timeout);
        }
        toProjectionConfig();
        return this;
    }

    /** Independent copy; later changes to either object do not reach the other. */
    public SplunkPumpConfig copy() {
        SplunkPumpConfig copy = new SplunkPumpConfig();
        copy.collectorToken = collectorToken;
        copy.collectorUrl = collectorUrl;
        copy.sslInsecureSkipVerify = sslInsecureSkipVerify;
        copy.sslCertFile = sslCertFile;
        copy.sslKeyFile = sslKeyFile;
        copy.sslServerName = sslServerName;
        copy.sslCaFile = sslCaFile;
        copy.obfuscateApiKeys = obfuscateApiKeys;
        copy.obfuscateApiKeysLength = obfuscateApiKeysLength;
        copy.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
        copy.deliveryPolicy = deliveryPolicy;
        copy.failOnHttpError = failOnHttpError;
        copy.maxConcurrency = maxConcurrency;
        copy.timeout = timeout;
        return copy;
    }

    public HecTransportSettings toTransportSettings() {
        return new HecTransportSettings(
                collectorToken, collectorUrl, sslInsecureSkipVerify, sslCertFile, sslKeyFile, sslServerName, sslCaFile);
    }

    public ProjectionConfig toProjectionConfig() {
        return new ProjectionConfig(fields, obfuscateApiKeys, obfuscateApiKeysLength);
    }

    public String getCollectorToken() {
        return collectorToken;
    }

    public void setCollectorToken(String collectorToken) {
        this.collectorToken = collectorToken;
    }

    public String getCollectorUrl() {
        return collectorUrl;
    }

    public void setCollectorUrl(String collectorUrl) {
        this.collectorUrl = collectorUrl;
    }

    public boolean isSslInsecureSkipVerify() {
        return sslInsecureSkipVerify;
    }

    public void setSslInsecureSkipVerify(boolean sslInsecureSkipVerify) {
        this.sslInsecureSkipVerify = sslInsecureSkipVerify;
    }

    public String getSslCertFile() {
        return sslCertFile;
    }

    public void setSslCertFile(String sslCertFile) {
        this.sslCertFile = sslCertFile;
    }

    public String getSslKeyFile() {
        return sslKeyFile;
    }

    public void setSslKeyFile(String sslKeyFile) {
        this.sslKeyFile = sslKeyFile;
    }

    public String getSslServerName() {
        return sslServerName;
    }

    public void setSslServerName(String sslServerName) {
        this.sslServerName = sslServerName;
    }

    public String getSslCaFile() {
        return sslCaFile;
    }

    public void setSslCaFile(String sslCaFile) {
        this.sslCaFile = sslCaFile;
    }

    public boolean isObfuscateApiKeys() {
        return obfuscateApiKeys;
    }

    public void setObfuscateApiKeys(boolean obfuscateApiKeys) {
        this.obfuscateApiKeys = obfuscateApiKeys;
    }

    public int getObfuscateApiKeysLength() {
        return obfuscateApiKeysLength;
    }

    public void setObfuscateApiKeysLength(int obfuscateApiKeysLength) {
        this.obfuscateApiKeysLength = obfuscateApiKeysLength;
    }

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
    }

    public DeliveryPolicy getDeliveryPolicy() {
        return deliveryPolicy;
    }

    public void setDeliveryPolicy(DeliveryPolicy deliveryPolicy) {
        this.deliveryPolicy = deliveryPolicy == null ? DeliveryPolicy.FIRE_AND_FORGET : deliveryPolicy;
    }

    public boolean isFailOnHttpError() {
        return failOnHttpError;
    }

    public void setFailOnHttpError(boolean failOnHttpError) {
        this.failOnHttpError = failOnHttpError;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        this.timeout = timeout;
    }

    @Override
    public String toString() {
        return "SplunkPumpConfig[collectorUrl=" + collectorUrl
                + ", sslInsecureSkipVerify=" + sslInsecureSkipVerify
                + ", fields=" + fields
                + ", obfuscateApiKeys=" + obfuscateApiKeys
                + ", deliveryPolicy=" + deliveryPolicy
                + ", maxConcurrency=" + maxConcurrency + "]";
    }
}
