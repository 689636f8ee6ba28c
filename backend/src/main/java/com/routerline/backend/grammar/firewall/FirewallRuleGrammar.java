package com.routerline.backend.grammar.firewall;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.Map;

/**
 * {@code firewall ipv4|ipv6} filter rules.
 * <ul>
 *   <li>{@code chain.*}: base chains, {@code chain} is forward, input or output</li>
 *   <li>{@code name.*}: custom chains, {@code chain} is the chain name</li>
 * </ul>
 * Rule operations take {@code chain} and {@code rule}, e.g. {@code chain.rule.source.address}.
 */
public class FirewallRuleGrammar extends FeatureGrammar {

    static final String[] ACTIONS = {"accept", "drop", "reject", "continue", "return", "jump", "queue", "synproxy"};
    static final String[] STATES = {"established", "new", "related", "invalid"};
    static final String[] GROUP_REFS = {"address-group", "network-group", "port-group", "mac-group", "domain-group", "remote-group"};

    private final FeatureFamily family;
    private final String ip;        // path token: ipv4 / ipv6
    private final String icmp;      // icmp / icmpv6
    private final String ttlLeaf;   // ttl / hop-limit

    private FirewallRuleGrammar(FeatureFamily family, String ip, String icmp, String ttlLeaf) {
        this.family = family;
        this.ip = ip;
        this.icmp = icmp;
        this.ttlLeaf = ttlLeaf;
    }

    public static FirewallRuleGrammar ipv4() {
        return new FirewallRuleGrammar(FeatureFamily.FIREWALL_IPV4, "ipv4", "icmp", "ttl");
    }

    public static FirewallRuleGrammar ipv6() {
        return new FirewallRuleGrammar(FeatureFamily.FIREWALL_IPV6, "ipv6", "icmpv6", "hop-limit");
    }

    @Override
    public FeatureFamily family() { return family; }

    @Override
    protected void define(GrammarBuilder g) {
        GrammarBuilder chain = g.scope("chain", "firewall " + ip + " {chain} filter");
        chain.leaf("default-action", "default-action {value}");
        ruleFields(chain.node("rule", "rule {rule}"));
        chain.allowAll("chain", "forward", "input", "output");

        GrammarBuilder custom = g.node("name", "firewall " + ip + " name {chain}");
        custom.leaf("description", "description {value}");
        custom.leaf("default-action", "default-action {value}");
        ruleFields(custom.node("rule", "rule {rule}"));
    }

    private void ruleFields(GrammarBuilder rule) {
        rule.leaf("description", "description {value}");
        rule.leaf("action", "action {value}").allow("action", "value", ACTIONS);
        rule.presence("disable", "disable");
        rule.presence("log", "log");
        rule.leaf("protocol", "protocol {value}");
        rule.leaf("jump-target", "jump-target {value}");

        for (String side : new String[]{"source", "destination"}) {
            GrammarBuilder s = rule.node(side, side);
            s.leaf("address", "address {value}");
            s.leaf("port", "port {value}");
            s.leaf("mac-address", "mac-address {value}");

            GrammarBuilder geoip = s.node("geoip", "geoip");
            geoip.multi("country-code", "country-code {value}");
            geoip.presence("inverse-match", "inverse-match");

            GrammarBuilder group = s.scope("group", "group");
            for (String ref : GROUP_REFS) group.leaf(ref, ref + " {value}");
        }

        for (String state : STATES) rule.presence("state." + state, "state " + state);

        rule.node("inbound-interface", "inbound-interface").leaf("name", "name {value}");
        rule.node("outbound-interface", "outbound-interface").leaf("name", "name {value}");

        GrammarBuilder set = rule.scope("set", "set");
        set.leaf("dscp", "dscp {value}");
        set.leaf("mark", "mark {value}");
        set.leaf(ttlLeaf, ttlLeaf + " {value}");

        rule.leaf("tcp.flags", "tcp flags {value*}");
        rule.leaf(icmp + ".type-name", icmp + " type-name {value}");
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4 -> o.unsupported(n -> n.endsWith(".group.remote-group"),
                    "Remote groups require VyOS 1.5+", "group.remote-group").build();
            case V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        boolean v4 = family == FeatureFamily.FIREWALL_IPV4;
        t.always("base_chains", "Forward, input, and output chains")
                .always("custom_chains", "Custom named chains")
                .always("basic_matching", v4
                        ? "Source/destination IP, port, protocol matching"
                        : "Source/destination IPv6 address, port, protocol matching")
                .always("firewall_groups", "Address, network, and port group references")
                .since(VersionTag.V1_5, "remote_group", "Remote group support (VyOS 1.5+ only)")
                .always("connection_state", "Connection tracking (established, new, related, invalid)")
                .always("tcp_flags", "TCP flag matching (syn, ack, fin, rst, etc.)")
                .always("packet_modifications", v4 ? "Set DSCP, mark, TTL" : "Set DSCP, mark, hop-limit")
                .always(v4 ? "icmp_matching" : "icmpv6_matching", v4 ? "ICMP type and code matching" : "ICMPv6 type matching")
                .always("interface_matching", "Inbound/outbound interface matching")
                .always("mac_matching", "Source MAC address matching")
                .always("jump_action", "Jump to custom chains");
    }
}
