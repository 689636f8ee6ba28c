package com.routerline.backend.device;

import com.routerline.backend.error.ValidationException;

import java.time.Duration;

/**
 * Everything needed to reach one router. The API key is never printed.
 */
public record DeviceContext(
        String deviceId,
        String host,
        int port,
        String protocol,
        String apiKey,
        String version,
        boolean verifyTls,
        Duration timeout
) {

    public DeviceContext {
        requireField("id", deviceId);
        requireField("host", host);
        requireField("api_key", apiKey);
        if (port <= 0 || port > 65535) throw new ValidationException("Invalid port: " + port);
        if (protocol == null || protocol.isBlank()) protocol = "https";
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ValidationException("Device timeout must be positive");
        }
    }

    public static DeviceContext of(String deviceId, String host, String apiKey, RouterlineDeviceProperties defaults) {
        return new DeviceContext(
                deviceId,
                host,
                defaults.getPort(),
                defaults.getProtocol(),
                apiKey,
                defaults.getDefaultVersion(),
                defaults.isVerifyTls(),
                defaults.getTimeout()
        );
    }

    public String baseUrl() {
        return protocol + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return "DeviceContext[" + deviceId + " " + baseUrl() + " v" + version + "]";
    }

    private static void requireField(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Instance missing required field: " + name);
        }
    }
}
