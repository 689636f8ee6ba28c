package com.routerline.backend.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.routerline.backend.compiler.Instruction;
import com.routerline.backend.error.DeviceCommException;
import com.routerline.backend.error.DeviceRejectedException;
import com.routerline.backend.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * One device's API plus its cached configuration.
 * <p>
 * Concurrent commits against the same device are not serialized here; the device's own configuration
 * session orders them. Callers that expect several writers to one device need an external lock.
 */
public class DeviceSession {

    private static final Logger log = LoggerFactory.getLogger(DeviceSession.class);

    private final DeviceContext device;
    private final DeviceTransport transport;
    private final DeviceConfigCache cache;
    private final Clock clock;

    public DeviceSession(DeviceContext device, DeviceTransport transport, DeviceConfigCache cache, Clock clock) {
        this.device = device;
        this.transport = transport;
        this.cache = cache;
        this.clock = clock;
    }

    public DeviceContext device() { return device; }

    /**
     * Sends the whole list as one configure request. The device applies it all or nothing.
     *
     * @throws DeviceRejectedException the device refused the batch; the cached config is kept
     * @throws DeviceCommException     no answer; the cached config is dropped since the outcome is unknown
     */
    public CommitResult commit(List<Instruction> instructions) {
        if (instructions == null || instructions.isEmpty()) {
            throw new ValidationException("No operations to execute");
        }
        String id = device.deviceId();
        int n = instructions.size();

        log.info("Committing {} instructions to {}", n, id);
        if (log.isDebugEnabled()) instructions.forEach(i -> log.debug("  {}", i));

        DeviceResponse resp;
        try {
            resp = transport.configure(instructions);
        } catch (DeviceCommException e) {
            cache.invalidate(id);
            log.warn("Commit to {} failed before an answer: {}", id, e.getMessage());
            throw e;
        }

        if (!resp.success()) {
            log.warn("Device {} rejected batch of {}: {}", id, n, resp.error());
            throw new DeviceRejectedException(id, resp.error(), n);
        }

        cache.invalidate(id);
        log.info("Device {} applied {} instructions", id, n);
        return new CommitResult(id, n, resp.data(), clock.instant());
    }

    /**
     * Cached full configuration, fetched when missing or when {@code forceRefresh} is set.
     */
    public DeviceConfigSnapshot getFullConfig(boolean forceRefresh) {
        String id = device.deviceId();
        if (!forceRefresh) {
            var cached = cache.get(id);
            if (cached.isPresent()) return cached.get();
        }

        long generation = cache.generation(id);
        DeviceConfigSnapshot fresh = fetch();
        if (cache.storeIfCurrent(id, generation, fresh)) {
            log.info("Refreshed configuration cache for {}", id);
        } else {
            log.debug("Configuration of {} changed during fetch; not caching it", id);
        }
        return fresh;
    }

    /** Writes the running configuration to disk on the device. */
    public void saveConfig(String file) {
        DeviceResponse resp = transport.saveConfigFile(file);
        if (!resp.success()) {
            log.warn("Device {} refused to save configuration: {}", device.deviceId(), resp.error());
            throw new DeviceRejectedException(device.deviceId(), resp.error(), 0);
        }
        log.info("Device {} saved configuration to {}", device.deviceId(), file == null ? "boot config" : file);
    }

    private DeviceConfigSnapshot fetch() {
        DeviceResponse resp = transport.showConfig(List.of());
        if (!resp.success()) {
            throw new DeviceRejectedException(device.deviceId(), resp.error(), 0);
        }
        JsonNode tree = resp.data();
        if (tree == null || tree.isNull()) tree = JsonNodeFactory.instance.objectNode();
        return new DeviceConfigSnapshot(device.deviceId(), tree, clock.instant());
    }
}
