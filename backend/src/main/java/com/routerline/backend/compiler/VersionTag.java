package com.routerline.backend.compiler;

import java.util.Locale;

public enum VersionTag {
    V1_4("1.4"),   // sagitta
    V1_5("1.5");   // circinus: dhcp options moved under "option", domain and remote groups

    private final String label;

    VersionTag(String label) {
        this.label = label;
    }

    public String label() { return label; }

    public boolean atLeast(VersionTag other) { return compareTo(other) >= 0; }

    public static VersionTag newest() {
        VersionTag[] all = values();
        return all[all.length - 1];
    }

    /**
     * Normalizes a raw firmware string ("1.4.2", "VyOS 1.5-rolling", "latest").
     * Anything unrecognized resolves to the newest known tag.
     */
    public static VersionTag fromRaw(String raw) {
        if (raw == null || raw.isBlank()) return newest();
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if ("latest".equals(s)) return newest();
        for (VersionTag tag : values()) {
            if (s.contains(tag.label)) return tag;
        }
        return newest();
    }
}
