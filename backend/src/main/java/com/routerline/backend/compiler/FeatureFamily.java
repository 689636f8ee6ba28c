package com.routerline.backend.compiler;

import com.routerline.backend.error.UnknownOperationException;

import java.util.Locale;

public enum FeatureFamily {
    FIREWALL_GROUPS("firewall-groups"),
    FIREWALL_IPV4("firewall-ipv4"),
    FIREWALL_IPV6("firewall-ipv6"),
    NAT("nat"),
    DHCP("dhcp"),
    ACCESS_LIST("access-list"),
    PREFIX_LIST("prefix-list"),
    AS_PATH_LIST("as-path-list"),
    COMMUNITY_LIST("community-list"),
    EXTCOMMUNITY_LIST("extcommunity-list"),
    LARGE_COMMUNITY_LIST("large-community-list"),
    ROUTE_MAP("route-map"),
    STATIC_ROUTES("static-routes"),
    LOCAL_ROUTE("local-route"),
    POLICY_ROUTE("policy-route");

    private final String id;

    FeatureFamily(String id) {
        this.id = id;
    }

    public String id() { return id; }

    public static FeatureFamily fromId(String raw) {
        String s = (raw == null) ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (FeatureFamily f : values()) {
            if (f.id.equals(s)) return f;
        }
        throw new UnknownOperationException(raw, "Unknown feature family: " + raw);
    }
}
