package com.routerline.backend.device;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks what each device last wrote to disk, so unsaved running changes can be listed.
 */
@Service
public class SavedConfigService {

    private static final Logger log = LoggerFactory.getLogger(SavedConfigService.class);

    private final DeviceSessionRegistry sessions;
    private final Map<String, DeviceConfigSnapshot> baselines = new ConcurrentHashMap<>();

    public SavedConfigService(DeviceSessionRegistry sessions) {
        this.sessions = sessions;
    }

    /** Saved baseline; the running configuration becomes the baseline when none was recorded. */
    public DeviceConfigSnapshot baseline(DeviceContext device) {
        DeviceConfigSnapshot existing = baselines.get(device.deviceId());
        if (existing != null) return existing;
        return markSaved(device);
    }

    public Optional<DeviceConfigSnapshot> findBaseline(String deviceId) {
        return Optional.ofNullable(baselines.get(deviceId));
    }

    /** Records the current running configuration as the saved state. */
    public DeviceConfigSnapshot markSaved(DeviceContext device) {
        DeviceConfigSnapshot current = sessions.session(device).getFullConfig(true);
        baselines.put(device.deviceId(), current);
        return current;
    }

    /**
     * Running configuration against the saved baseline. Without a baseline nothing is reported.
     */
    public ConfigDiff diff(DeviceContext device) {
        DeviceConfigSnapshot current = sessions.session(device).getFullConfig(true);
        DeviceConfigSnapshot saved = baselines.get(device.deviceId());
        if (saved == null) return ConfigDiff.none();
        return ConfigDiff.between(current.tree(), saved.tree());
    }

    /**
     * Saves the running configuration on the device ({@code file} null means the boot config) and
     * moves the baseline to it.
     */
    public DeviceConfigSnapshot save(DeviceContext device, String file) {
        DeviceSession session = sessions.session(device);
        session.saveConfig(file);
        DeviceConfigSnapshot current = session.getFullConfig(true);
        baselines.put(device.deviceId(), current);
        log.info("Baseline for {} moved to saved configuration", device.deviceId());
        return current;
    }
}
