package com.hecsink.spring.autoconfigure;

import com.hecsink.core.pump.DeliveryPolicy;
import com.hecsink.core.pump.SplunkPumpConfig;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the Splunk HEC pump.
 *
 * <p>Mirrors the pump's map keys in kebab case. The auto-configuration only activates when
 * {@code collector-url} is set.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * hecsink:
 *   splunk:
 *     collector-url: https://splunk.example.com:8088
 *     collector-token: ${SPLUNK_HEC_TOKEN}
 *     ssl-cert-file: /etc/hec/client.pem
 *     ssl-key-file: /etc/hec/client-key.pem
 *     obfuscate-api-keys: true
 *     obfuscate-api-keys-length: 4
 *     fields: [method, path, response_code, api_key]
 *     delivery-policy: fire_and_forget
 * }</pre>
 *
 * @see SplunkPumpConfig
 */
@ConfigurationProperties(prefix = "hecsink.splunk")
public class HecSinkProperties {

    /** HEC token, sent as {@code authorization: Splunk <token>}. */
    private String collectorToken;

    /** Base URL of the collector. Its path is replaced with the event endpoint path. */
    private String collectorUrl;

    /** Trust any server certificate and skip hostname checks. */
    private boolean sslInsecureSkipVerify;

    /** PEM client certificate, required unless verification is skipped. */
    private String sslCertFile;

    /** PEM (PKCS#8) private key for {@link #sslCertFile}. */
    private String sslKeyFile;

    /** Name to verify the server certificate against instead of the URL host. */
    private String sslServerName;

    /** Extra PEM trust root added to the platform trust store. */
    private String sslCaFile;

    /** Mask {@code api_key} in events when fields are listed explicitly. */
    private boolean obfuscateApiKeys;

    /** Trailing characters of the API key left visible after masking. */
    private int obfuscateApiKeysLength;

    /**
     * Event fields to emit, in order. Empty means the default fourteen fields.
     *
     * <p>Redaction of {@code api_key} only applies when fields are listed explicitly.
     */
    private List<String> fields = new ArrayList<>();

    /** Whether failed events are only reported ({@code fire_and_forget}) or also thrown ({@code aggregate}). */
    private DeliveryPolicy deliveryPolicy = DeliveryPolicy.FIRE_AND_FORGET;

    /** Treat non-2xx collector responses as delivery failures. */
    private boolean failOnHttpError;

    /** Number of events of one batch sent in parallel; 1 sends them one after another. */
    private int maxConcurrency = 1;

    /** Per-batch deadline in seconds, 0 for none. */
    private int timeout;

    /**
     * Converts the bound properties into a pump configuration.
     *
     * @return a new, unvalidated configuration
     */
    public SplunkPumpConfig toPumpConfig() {
        SplunkPumpConfig config = new SplunkPumpConfig();
        config.setCollectorToken(collectorToken);
        config.setCollectorUrl(collectorUrl);
        config.setSslInsecureSkipVerify(sslInsecureSkipVerify);
        config.setSslCertFile(sslCertFile);
        config.setSslKeyFile(sslKeyFile);
        config.setSslServerName(sslServerName);
        config.setSslCaFile(sslCaFile);
        config.setObfuscateApiKeys(obfuscateApiKeys);
        config.setObfuscateApiKeysLength(obfuscateApiKeysLength);
        config.setFields(new ArrayList<>(fields));
        config.setDeliveryPolicy(deliveryPolicy);
        config.setFailOnHttpError(failOnHttpError);
        config.setMaxConcurrency(maxConcurrency);
        config.setTimeout(timeout);
        return config;
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
        this.fields = fields;
    }

    public DeliveryPolicy getDeliveryPolicy() {
        return deliveryPolicy;
    }

    public void setDeliveryPolicy(DeliveryPolicy deliveryPolicy) {
        this.deliveryPolicy = deliveryPolicy;
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
}
