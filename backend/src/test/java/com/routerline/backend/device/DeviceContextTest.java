package com.routerline.backend.device;

import com.routerline.backend.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DeviceContextTest {

    @Test
    void of_appliesConfiguredDefaults() {
        RouterlineDeviceProperties props = new RouterlineDeviceProperties();
        props.setPort(8443);
        props.setDefaultVersion("1.4");

        DeviceContext d = DeviceContext.of("r1", "router.lab", "k", props);

        assertEquals("https://router.lab:8443", d.baseUrl());
        assertEquals("1.4", d.version());
        assertFalse(d.verifyTls());
        assertEquals(Duration.ofSeconds(30), d.timeout());
    }

    @Test
    void missingApiKey_isValidationError() {
        var e = assertThrows(ValidationException.class, () ->
                new DeviceContext("r1", "router.lab", 443, "https", " ", "1.5", false, Duration.ofSeconds(1)));

        assertEquals("Instance missing required field: api_key", e.getMessage());
    }

    @Test
    void toString_neverShowsKey() {
        DeviceContext d = new DeviceContext("r1", "h", 443, "https", "super-secret", "1.5", true, Duration.ofSeconds(1));

        assertFalse(d.toString().contains("super-secret"));
    }
}
