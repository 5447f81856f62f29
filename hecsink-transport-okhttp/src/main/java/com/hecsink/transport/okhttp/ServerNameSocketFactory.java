package com.hecsink.transport.okhttp;

import java.io.IOException;
import java.net.InetAddress;
import java.net.Socket;
import java.util.List;
import java.util.Objects;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;

/**
 * Sends a fixed SNI name on every TLS socket instead of the host from the URL. Settings applied
 * later through {@link SSLSocket#setSSLParameters} keep the name because OkHttp reads the
 * current parameters before changing them.
 */
final class ServerNameSocketFactory extends SSLSocketFactory {
    private final SSLSocketFactory delegate;
    private final SNIHostName serverName;

    ServerNameSocketFactory(SSLSocketFactory delegate, SNIHostName serverName) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.serverName = Objects.requireNonNull(serverName, "serverName");
    }

    @Override
    public String[] getDefaultCipherSuites() {
        return delegate.getDefaultCipherSuites();
    }

    @Override
    public String[] getSupportedCipherSuites() {
        return delegate.getSupportedCipherSuites();
    }

    @Override
    public Socket createSocket() throws IOException {
        return withServerName(delegate.createSocket());
    }

    @Override
    public Socket createSocket(Socket socket, String host, int port, boolean autoClose) throws IOException {
        return withServerName(delegate.createSocket(socket, host, port, autoClose));
    }

    @Override
    public Socket createSocket(String host, int port) throws IOException {
        return withServerName(delegate.createSocket(host, port));
    }

    @Override
    public Socket createSocket(String host, int port, InetAddress localHost, int localPort) throws IOException {
        return withServerName(delegate.createSocket(host, port, localHost, localPort));
    }

    @Override
    public Socket createSocket(InetAddress host, int port) throws IOException {
        return withServerName(delegate.createSocket(host, port));
    }

    @Override
    public Socket createSocket(InetAddress address, int port, InetAddress localAddress, int localPort)
            throws IOException {
        return withServerName(delegate.createSocket(address, port, localAddress, localPort));
    }

    private Socket withServerName(Socket socket) {
        if (socket instanceof SSLSocket sslSocket) {
            SSLParameters parameters = sslSocket.getSSLParameters();
            parameters.setServerNames(List.of(serverName));
            sslSocket.setSSLParameters(parameters);
        }
        return socket;
    }
}
