package com.routerline.backend.device;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last known full configuration per device.
 * <p>
 * Each device has one slot holding a generation counter and the snapshot. Invalidation bumps the
 * generation, and a fetch may only store its result if the generation it started under is still
 * current, so a fetch racing a commit can never re-install pre-commit data.
 */
@Component
public class DeviceConfigCache {

    record Slot(long generation, DeviceConfigSnapshot snapshot) {}

    private final Map<String, AtomicReference<Slot>> slots = new ConcurrentHashMap<>();

    public Optional<DeviceConfigSnapshot> get(String deviceId) {
        return Optional.ofNullable(slot(deviceId).get().snapshot());
    }

    public long generation(String deviceId) {
        return slot(deviceId).get().generation();
    }

    /** @return false when the device was invalidated after {@code expectedGeneration} was read */
    public boolean storeIfCurrent(String deviceId, long expectedGeneration, DeviceConfigSnapshot snapshot) {
        AtomicReference<Slot> ref = slot(deviceId);
        Slot cur = ref.get();
        if (cur.generation() != expectedGeneration) return false;
        return ref.compareAndSet(cur, new Slot(expectedGeneration, snapshot));
    }

    public void invalidate(String deviceId) {
        slot(deviceId).updateAndGet(s -> new Slot(s.generation() + 1, null));
    }

    // slots are never removed: a fetch holding an old generation must keep failing its store
    public void clear() {
        slots.keySet().forEach(this::invalidate);
    }

    private AtomicReference<Slot> slot(String deviceId) {
        return slots.computeIfAbsent(deviceId, k -> new AtomicReference<>(new Slot(0L, null)));
    }
}
