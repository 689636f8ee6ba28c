package com.routerline.backend.device;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "routerline.device")
public class RouterlineDeviceProperties {

    private String protocol = "https";
    private int port = 443;

    /**
     * Most routers ship a self-signed certificate for the HTTP API.
     */
    private boolean verifyTls = false;

    /**
     * Bounds both the connect and the read of every device round trip.
     */
    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Used when a device record carries no firmware version.
     */
    private String defaultVersion = "1.5";

    /**
     * Fetch the full configuration when a session is first opened.
     */
    private boolean prefetchOnConnect = true;

    public String getProtocol() { return protocol; }
    public void setProtocol(String protocol) { this.protocol = protocol; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public boolean isVerifyTls() { return verifyTls; }
    public void setVerifyTls(boolean verifyTls) { this.verifyTls = verifyTls; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public String getDefaultVersion() { return defaultVersion; }
    public void setDefaultVersion(String defaultVersion) { this.defaultVersion = defaultVersion; }

    public boolean isPrefetchOnConnect() { return prefetchOnConnect; }
    public void setPrefetchOnConnect(boolean prefetchOnConnect) { this.prefetchOnConnect = prefetchOnConnect; }
}
