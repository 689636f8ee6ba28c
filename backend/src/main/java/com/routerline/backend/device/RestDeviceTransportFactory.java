package com.routerline.backend.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

public class RestDeviceTransportFactory implements DeviceTransportFactory {

    private static final Logger log = LoggerFactory.getLogger(RestDeviceTransportFactory.class);

    private final RestClient.Builder builder;
    private final ObjectMapper om;

    public RestDeviceTransportFactory(RestClient.Builder builder, ObjectMapper om) {
        this.builder = builder;
        this.om = om;
    }

    @Override
    public DeviceTransport create(DeviceContext device) {
        HttpClient.Builder http = HttpClient.newBuilder()
                .connectTimeout(device.timeout())
                .followRedirects(HttpClient.Redirect.NEVER);

        if (!device.verifyTls()) {
            log.warn("TLS verification disabled for device {}", device.deviceId());
            http.sslContext(trustAll());
        }

        JdkClientHttpRequestFactory requests = new JdkClientHttpRequestFactory(http.build());
        requests.setReadTimeout(device.timeout());

        RestClient rest = builder.clone()
                .requestFactory(requests)
                .baseUrl(device.baseUrl())
                .build();

        return new VyosHttpTransport(rest, om, device.deviceId(), device.apiKey());
    }

    private static SSLContext trustAll() {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new TrustAllTrustManager()}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("cannot build TLS context", e);
        }
    }
}
