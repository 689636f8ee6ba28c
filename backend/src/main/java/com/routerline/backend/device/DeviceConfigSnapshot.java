package com.routerline.backend.device;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * Full configuration tree of one device as last fetched. The tree is copied in and out, so a
 * snapshot can be handed to any number of readers.
 */
public record DeviceConfigSnapshot(String deviceId, JsonNode tree, Instant fetchedAt) {

    public DeviceConfigSnapshot {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        tree = tree.deepCopy();
    }

    @Override
    public JsonNode tree() {
        return tree.deepCopy();
    }
}
