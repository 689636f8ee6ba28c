package com.routerline.backend.grammar.routing;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.Map;

/**
 * {@code protocols static}. Routes take {@code destination}; next-hop and interface entries add
 * {@code nexthop} / {@code interface}. Table routes also take {@code table}.
 * <p>
 * Multicast moved from {@code multicast route|interface-route} (1.4) to {@code mroute} (1.5).
 */
public class StaticRouteGrammar extends FeatureGrammar {

    private static final String PREFIX = "protocols static";

    @Override
    public FeatureFamily family() { return FeatureFamily.STATIC_ROUTES; }

    @Override
    protected void define(GrammarBuilder g) {
        GrammarBuilder v4 = g.node("ipv4", PREFIX + " route {destination}");
        route(v4, false);
        GrammarBuilder dhcp = v4.node("dhcp-interface", "dhcp-interface {interface}");
        dhcp.leaf("distance", "distance {value}");

        route(g.node("ipv6", PREFIX + " route6 {destination}"), true);

        GrammarBuilder table = g.node("table", PREFIX + " table {table}");
        table.leaf("description", "description {value}");
        route(table.node("ipv4", "route {destination}"), false);
        route(table.node("ipv6", "route6 {destination}"), true);

        g.leaf("route-map", PREFIX + " route-map {value}");
        g.leaf("arp.mac", PREFIX + " arp {address} mac {value}");
        g.leaf("neighbor-proxy.arp.interface", PREFIX + " neighbor-proxy arp {address} interface {value}");
        g.leaf("neighbor-proxy.nd.interface", PREFIX + " neighbor-proxy nd {address} interface {value}");

        GrammarBuilder multicast = g.scope("multicast", PREFIX + " multicast");
        multicast.node("route", "route {destination}")
                .node("next-hop", "next-hop {nexthop}");
        multicast.node("interface-route", "interface-route {destination}")
                .node("next-hop-interface", "next-hop-interface {interface}");

        GrammarBuilder mroute = g.node("mroute", PREFIX + " mroute {destination}");
        mroute.node("interface", "interface {interface}");
        mroute.node("next-hop", "next-hop {nexthop}");
    }

    private static void route(GrammarBuilder route, boolean ipv6) {
        route.leaf("description", "description {value}");

        GrammarBuilder hop = route.node("next-hop", "next-hop {nexthop}");
        hop.leaf("distance", "distance {value}");
        hop.presence("disable", "disable");
        hop.node("bfd", "bfd");
        hop.leaf("bfd.profile", "bfd profile {value}");
        hop.leaf("vrf", "vrf {value}");

        GrammarBuilder iface = route.node("interface", "interface {interface}");
        iface.leaf("distance", "distance {value}");
        iface.presence("disable", "disable");

        if (ipv6) {
            hop.leaf("segments", "segments {value}");
            iface.leaf("segments", "segments {value}");
        }

        for (String target : new String[]{"blackhole", "reject"}) {
            GrammarBuilder t = route.node(target, target);
            t.leaf("distance", "distance {value}");
            t.leaf("tag", "tag {value}");
        }
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4 -> o
                    .unsupported(n -> n.endsWith(".next-hop.bfd") || n.endsWith(".next-hop.bfd.profile"),
                            "BFD for static routes requires VyOS 1.5+", "bfd")
                    .unsupported(n -> n.endsWith(".next-hop.vrf"), "Next-hop VRF requires VyOS 1.5+", "vrf")
                    .unsupported("mroute", "mroute requires VyOS 1.5+; use multicast routes on 1.4")
                    .build();
            case V1_5 -> o
                    .unsupported("multicast", "Multicast static routes were replaced by mroute in VyOS 1.5")
                    .unsupported("ipv4.dhcp-interface", "DHCP interface routes are only available in VyOS 1.4")
                    .build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("ipv4_routes", "IPv4 static routes")
                .always("ipv6_routes", "IPv6 static routes")
                .always("routing_tables", "Policy routing tables")
                .always("blackhole_routes", "Blackhole and reject routes")
                .always("interface_routes", "Interface-based routes")
                .always("route_map", "Route-map for static routes")
                .always("arp", "Static ARP entries")
                .always("neighbor_proxy", "Neighbor proxy ARP/ND")
                .since(VersionTag.V1_5, "next_hop_bfd", "BFD monitoring for next-hops (VyOS 1.5+)")
                .since(VersionTag.V1_5, "next_hop_vrf", "Next-hop VRF lookup (VyOS 1.5+)")
                .since(VersionTag.V1_5, "mroute_1_5", "Multicast routes via mroute (VyOS 1.5+)")
                .only(VersionTag.V1_4, "multicast_routes_1_4", "Multicast routes (VyOS 1.4 syntax)")
                .only(VersionTag.V1_4, "dhcp_interface_1_4", "DHCP interface routes (VyOS 1.4 only)");
    }
}
