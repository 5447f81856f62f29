package com.hecsink.transport.okhttp;

import com.hecsink.transport.HecTransportSettings;
import com.hecsink.transport.TlsSetupException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import okhttp3.OkHttpClient;
import okhttp3.tls.Certificates;
import okhttp3.tls.HandshakeCertificates;
import okhttp3.tls.HeldCertificate;
import org.apache.hc.client5.http.ssl.DefaultHostnameVerifier;
import org.apache.hc.core5.net.InetAddressUtils;

/**
 * Applies the TLS part of {@link HecTransportSettings} to a client builder.
 *
 * <p>A configured server name replaces the URL host both as the SNI name sent in the handshake
 * and as the name the server certificate must match. IP literals are never sent as SNI.
 */
final class TlsConfigurer {

    private TlsConfigurer() {}

    static OkHttpClient.Builder configure(HecTransportSettings settings, OkHttpClient.Builder builder) {
        if (settings.insecureSkipVerify()) {
            return trustEverything(builder);
        }

        HeldCertificate clientCertificate = loadKeyPair(settings.certFile(), settings.keyFile());
        HandshakeCertificates.Builder handshake = new HandshakeCertificates.Builder()
                .heldCertificate(clientCertificate)
                .addPlatformTrustedCertificates();
        if (settings.hasCaFile()) {
            handshake.addTrustedCertificate(loadCertificate(settings.caFile()));
        }
        HandshakeCertificates certificates = handshake.build();
        SSLSocketFactory socketFactory = certificates.sslSocketFactory();

        if (settings.hasServerName()) {
            String serverName = settings.serverName().trim();
            if (!isIpLiteral(serverName)) {
                socketFactory = new ServerNameSocketFactory(socketFactory, sniName(serverName));
            }
            DefaultHostnameVerifier verifier = new DefaultHostnameVerifier();
            builder.hostnameVerifier((host, session) -> verifier.verify(serverName, session));
        }
        return builder.sslSocketFactory(socketFactory, certificates.trustManager());
    }

    static SNIHostName sniName(String serverName) {
        try {
            return new SNIHostName(serverName);
        } catch (IllegalArgumentException e) {
            throw new TlsSetupException("Invalid ssl_server_name " + serverName, e);
        }
    }

    private static boolean isIpLiteral(String name) {
        return InetAddressUtils.isIPv4Address(name) || InetAddressUtils.isIPv6Address(name);
    }

    static HeldCertificate loadKeyPair(String certFile, String keyFile) {
        if (certFile == null || certFile.isBlank() || keyFile == null || keyFile.isBlank()) {
            throw new TlsSetupException(
                    "ssl_cert_file and ssl_key_file are required unless ssl_insecure_skip_verify is set", null);
        }
        try {
            String pem = Files.readString(Path.of(certFile)) + "\n" + Files.readString(Path.of(keyFile));
            return HeldCertificate.decode(pem);
        } catch (IOException | RuntimeException e) {
            throw new TlsSetupException("Failed to load client key pair " + certFile + " / " + keyFile, e);
        }
    }

    static X509Certificate loadCertificate(String caFile) {
        try {
            return Certificates.decodeCertificatePem(Files.readString(Path.of(caFile)));
        } catch (IOException | RuntimeException e) {
            throw new TlsSetupException("Failed to load CA certificate " + caFile, e);
        }
    }

    private static OkHttpClient.Builder trustEverything(OkHttpClient.Builder builder) {
        X509TrustManager trustAll = new TrustAllManager();
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[] {trustAll}, new SecureRandom());
            return builder.sslSocketFactory(context.getSocketFactory(), trustAll)
                    .hostnameVerifier((host, session) -> true);
        } catch (GeneralSecurityException e) {
            throw new TlsSetupException("Failed to initialise insecure TLS context", e);
        }
    }

    /** Accepts any server chain; only used with ssl_insecure_skip_verify. */
    private static final class TrustAllManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // trusted
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // trusted
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
