package com.hecsink.transport;

/**
 * Connection settings for one collector.
 *
 * @param token HEC token sent as {@code authorization: Splunk <token>}; required
 * @param collectorUrl collector base URL; required, its path is replaced by {@link HecSender#COLLECTOR_PATH}
 * @param insecureSkipVerify disables certificate and hostname verification
 * @param certFile PEM client certificate, required unless {@code insecureSkipVerify}
 * @param keyFile PEM (PKCS#8) private key for {@code certFile}
 * @param serverName name the server certificate must match; the URL host when blank
 * @param caFile optional PEM certificate trusted in addition to the platform roots
 */
public record HecTransportSettings(
        String token,
        String collectorUrl,
        boolean insecureSkipVerify,
        String certFile,
        String keyFile,
        String serverName,
        String caFile) {

    public static HecTransportSettings insecure(String token, String collectorUrl) {
        return new HecTransportSettings(token, collectorUrl, true, null, null, null, null);
    }

    public HecTransportSettings requireComplete() {
        if (isBlank(token) || isBlank(collectorUrl)) {
            throw new InvalidSettingsException("Empty settings: collector token and collector URL are required");
        }
        return this;
    }

    public boolean hasServerName() {
        return !isBlank(serverName);
    }

    public boolean hasCaFile() {
        return !isBlank(caFile);
    }

    // keeps the token out of logs
    @Override
    public String toString() {
        return "HecTransportSettings[collectorUrl=" + collectorUrl
                + ", insecureSkipVerify=" + insecureSkipVerify
                + ", certFile=" + certFile
                + ", keyFile=" + keyFile
                + ", serverName=" + serverName
                + ", caFile=" + caFile + "]";
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
