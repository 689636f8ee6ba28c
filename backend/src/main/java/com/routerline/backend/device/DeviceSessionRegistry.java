package com.routerline.backend.device;

import com.routerline.backend.error.DeviceCommException;
import com.routerline.backend.error.DeviceRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open device sessions, keyed by device id. A session is rebuilt when the device's connection
 * details change.
 */
@Service
public class DeviceSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceSessionRegistry.class);

    private record Entry(DeviceContext device, DeviceSession session) {}

    private final DeviceTransportFactory transports;
    private final DeviceConfigCache cache;
    private final RouterlineDeviceProperties props;
    private final Clock clock;

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();

    public DeviceSessionRegistry(DeviceTransportFactory transports,
                                 DeviceConfigCache cache,
                                 RouterlineDeviceProperties props,
                                 Clock clock) {
        this.transports = transports;
        this.cache = cache;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Opens (or reuses) the device's session and, when {@code prefetch-on-connect} is set, loads its
     * configuration into the cache. A failed prefetch leaves the session open with a cold cache.
     */
    public DeviceSession connect(DeviceContext device) {
        DeviceSession session = session(device);
        if (props.isPrefetchOnConnect()) prefetch(session);
        return session;
    }

    /** Session for the device without touching it; opening one makes no device call. */
    public DeviceSession session(DeviceContext device) {
        String id = device.deviceId();
        Entry current = sessions.get(id);
        if (current != null && current.device().equals(device)) return current.session();

        Entry created = new Entry(device, new DeviceSession(device, transports.create(device), cache, clock));
        Entry winner = sessions.compute(id, (k, existing) ->
                (existing != null && existing.device().equals(device)) ? existing : created);

        if (winner == created) {
            if (current != null) cache.invalidate(id);
            log.info("Opened session for {}", device);
        }
        return winner.session();
    }

    public Optional<DeviceSession> find(String deviceId) {
        Entry e = sessions.get(deviceId);
        return e == null ? Optional.empty() : Optional.of(e.session());
    }

    public void evict(String deviceId) {
        if (sessions.remove(deviceId) != null) log.info("Closed session for {}", deviceId);
        cache.invalidate(deviceId);
    }

    public void clear() {
        sessions.keySet().forEach(this::evict);
    }

    // the first real read fetches again if this fails
    private void prefetch(DeviceSession session) {
        try {
            session.getFullConfig(false);
        } catch (DeviceCommException | DeviceRejectedException e) {
            log.warn("Could not pre-cache configuration for {}: {}", session.device().deviceId(), e.getMessage());
        }
    }
}
