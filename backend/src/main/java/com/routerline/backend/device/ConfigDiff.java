package com.routerline.backend.device;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Differences between a running configuration and a saved one, keyed by dot-joined node path.
 */
public record ConfigDiff(
        Map<String, JsonNode> added,
        Map<String, JsonNode> removed,
        Map<String, Change> modified
) {

    public record Change(JsonNode oldValue, JsonNode newValue) {}

    public record Summary(int added, int removed, int modified) {}

    public ConfigDiff {
        added = Collections.unmodifiableMap(new LinkedHashMap<>(added));
        removed = Collections.unmodifiableMap(new LinkedHashMap<>(removed));
        modified = Collections.unmodifiableMap(new LinkedHashMap<>(modified));
    }

    public static ConfigDiff none() {
        return new ConfigDiff(Map.of(), Map.of(), Map.of());
    }

    public static ConfigDiff between(JsonNode current, JsonNode saved) {
        Map<String, JsonNode> added = new LinkedHashMap<>();
        Map<String, JsonNode> removed = new LinkedHashMap<>();
        Map<String, Change> modified = new LinkedHashMap<>();
        walk(current, saved, "", added, removed, modified);
        return new ConfigDiff(added, removed, modified);
    }

    public boolean hasChanges() {
        return !added.isEmpty() || !removed.isEmpty() || !modified.isEmpty();
    }

    public Summary summary() {
        return new Summary(added.size(), removed.size(), modified.size());
    }

    private static void walk(JsonNode current, JsonNode saved, String path,
                             Map<String, JsonNode> added,
                             Map<String, JsonNode> removed,
                             Map<String, Change> modified) {
        Iterator<Map.Entry<String, JsonNode>> it = current.fields();
        while (it.hasNext()) {
            var e = it.next();
            String key = path.isEmpty() ? e.getKey() : path + "." + e.getKey();
            JsonNode old = saved.get(e.getKey());
            if (old == null) {
                added.put(key, e.getValue());
            } else if (e.getValue().isObject() && old.isObject()) {
                walk(e.getValue(), old, key, added, removed, modified);
            } else if (!e.getValue().equals(old)) {
                modified.put(key, new Change(old, e.getValue()));
            }
        }

        Iterator<Map.Entry<String, JsonNode>> old = saved.fields();
        while (old.hasNext()) {
            var e = old.next();
            if (!current.has(e.getKey())) {
                removed.put(path.isEmpty() ? e.getKey() : path + "." + e.getKey(), e.getValue());
            }
        }
    }
}
