package com.routerline.backend.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.routerline.backend.compiler.Instruction;
import com.routerline.backend.compiler.Path;
import com.routerline.backend.error.DeviceCommException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RestDeviceTransportFactoryTest {

    // accepts connections into its backlog and never answers
    private ServerSocket silent;

    @BeforeEach
    void setUp() throws IOException {
        silent = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
    }

    @AfterEach
    void tearDown() throws IOException {
        silent.close();
    }

    private DeviceTransport transport(Duration timeout) {
        DeviceContext device = new DeviceContext("r1", "127.0.0.1", silent.getLocalPort(), "http",
                "k", "1.5", true, timeout);
        return new RestDeviceTransportFactory(RestClient.builder(), new ObjectMapper()).create(device);
    }

    @Test
    void configure_silentDevice_timesOutAsCommFailure() {
        DeviceTransport transport = transport(Duration.ofSeconds(1));

        long started = System.nanoTime();
        var e = assertThrows(DeviceCommException.class, () -> transport.configure(
                List.of(Instruction.set(Path.of("nat", "source", "rule", "100")))));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertEquals("r1", e.getDeviceId());
        assertTrue(elapsedMs >= 900, "gave up before the timeout: " + elapsedMs + "ms");
        assertTrue(elapsedMs < 5000, "did not honour the timeout: " + elapsedMs + "ms");
    }

    @Test
    void showConfig_silentDevice_timesOutAsCommFailure() {
        DeviceTransport transport = transport(Duration.ofSeconds(1));

        long started = System.nanoTime();
        assertThrows(DeviceCommException.class, () -> transport.showConfig(List.of()));

        assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 5000);
    }
}
