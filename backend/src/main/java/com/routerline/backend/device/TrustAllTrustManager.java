package com.routerline.backend.device;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.security.cert.X509Certificate;

/**
 * Accepts any server certificate and skips host name checks. Only installed for devices configured
 * with {@code verifyTls=false}.
 */
final class TrustAllTrustManager extends X509ExtendedTrustManager {

    @Override public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) { clientSideOnly(); }
    @Override public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) { clientSideOnly(); }
    @Override public void checkClientTrusted(X509Certificate[] chain, String authType) { clientSideOnly(); }

    @Override public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}
    @Override public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
    @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
    @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }

    private static void clientSideOnly() {
        throw new IllegalStateException("TrustAllTrustManager is for outbound device connections only");
    }
}
