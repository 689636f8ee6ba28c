package com.routerline.backend.grammar.policy;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.List;
import java.util.Map;

/**
 * Policy-based routing, {@code policy route <policy>} ({@code ipv4.*}) and {@code policy route6 <policy>}
 * ({@code ipv6.*}). Rule operations take {@code policy} and {@code rule}.
 */
public class PolicyRouteGrammar extends FeatureGrammar {

    private static final String[] GROUP_TYPES = {"address-group", "domain-group", "mac-group", "network-group", "port-group"};

    @Override
    public FeatureFamily family() { return FeatureFamily.POLICY_ROUTE; }

    @Override
    protected void define(GrammarBuilder g) {
        policy(g.node("ipv4", "policy route {policy}"), "icmp", "ttl");
        policy(g.node("ipv6", "policy route6 {policy}"), "icmpv6", "hop-limit");
    }

    private static void policy(GrammarBuilder policy, String icmp, String hopField) {
        policy.leaf("description", "description {value}");
        policy.presence("default-log", "default-log");
        policy.multi("interface", "interface {value}");

        GrammarBuilder rule = policy.node("rule", "rule {rule}");
        rule.leaf("description", "description {value}");
        rule.presence("disable", "disable");
        rule.leaf("log", "log {value}").allow("log", "value", "enable", "disable");
        rule.leaf("protocol", "protocol {value}");
        rule.leaf("tcp.flags", "tcp flags {value*}");

        for (String side : new String[]{"source", "destination"}) {
            rule.node(side, side);
            rule.leaf(side + ".address", side + " address {value}");
            rule.leaf(side + ".mac-address", side + " mac-address {value}");
            rule.leaf(side + ".port", side + " port {value}");
            rule.leaf(side + ".group", side + " group {type} {value}")
                    .allow(side + ".group", "type", GROUP_TYPES);
        }

        rule.node(icmp, icmp);
        rule.leaf(icmp + ".code", icmp + " code {value}");
        rule.leaf(icmp + ".type", icmp + " type {value}");
        rule.leaf(icmp + ".type-name", icmp + " type-name {value}");

        rule.leaf("fragment", "fragment {value}");
        rule.leaf("packet-type", "packet-type {value}");
        rule.leaf("packet-length", "packet-length {value}");
        rule.leaf("packet-length-exclude", "packet-length-exclude {value}");
        rule.leaf("dscp", "dscp {value}");
        rule.leaf("dscp-exclude", "dscp-exclude {value}");
        rule.multi("state", "state {value}");
        rule.leaf("ipsec", "ipsec {value}");
        rule.leaf("mark", "mark {value}");
        rule.leaf("connection-mark", "connection-mark {value}");
        rule.compound(hopField, List.of(hopField + " {op} {value}"), List.of(hopField))
                .allow(hopField, "op", "eq", "gt", "lt");

        rule.node("time", "time");
        for (String f : new String[]{"monthdays", "startdate", "starttime", "stopdate", "stoptime", "weekdays"}) {
            rule.leaf("time." + f, "time " + f + " {value}");
        }
        rule.presence("time.utc", "time utc");

        rule.leaf("limit.burst", "limit burst {value}");
        rule.leaf("limit.rate", "limit rate {value}");
        rule.leaf("recent.count", "recent count {value}");
        rule.leaf("recent.time", "recent time {value}");

        rule.node("set", "set");
        for (String f : new String[]{"connection-mark", "dscp", "mark", "table", "tcp-mss", "vrf"}) {
            rule.leaf("set." + f, "set " + f + " {value}");
        }
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4 -> o
                    .unsupported(n -> n.endsWith(".rule.set.vrf"), "Policy route VRF requires VyOS 1.5+", "set.vrf")
                    .build();
            case V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("ipv4_policy_route", "IPv4 policy-based routing")
                .always("ipv6_policy_route", "IPv6 policy-based routing")
                .always("time_based_matching", "Match on time of day and date ranges")
                .always("rate_limiting", "Limit and recent-connection matching")
                .always("firewall_groups", "Match on firewall groups")
                .since(VersionTag.V1_5, "vrf_routing", "Route into a VRF (VyOS 1.5+)");
    }
}
