package com.routerline.backend.grammar.nat;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.Map;

/**
 * {@code nat source|destination|static rule <rule>}. Operations are prefixed with the NAT type:
 * {@code source.rule.translation.address}, {@code static.rule.inbound-interface}, ...
 */
public class NatGrammar extends FeatureGrammar {

    private static final String[] GROUP_TYPES = {"address-group", "network-group", "port-group", "domain-group", "mac-group"};

    @Override
    public FeatureFamily family() { return FeatureFamily.NAT; }

    @Override
    protected void define(GrammarBuilder g) {
        GrammarBuilder snat = g.scope("source", "nat source").node("rule", "rule {rule}");
        translatedRule(snat);
        snat.leaf("outbound-interface.name", "outbound-interface name {value}");
        snat.leaf("outbound-interface.group", "outbound-interface group {value}");

        GrammarBuilder dnat = g.scope("destination", "nat destination").node("rule", "rule {rule}");
        translatedRule(dnat);
        dnat.leaf("inbound-interface.name", "inbound-interface name {value}");
        dnat.leaf("inbound-interface.group", "inbound-interface group {value}");
        dnat.leaf("translation.port", "translation port {value}");

        GrammarBuilder stat = g.scope("static", "nat static").node("rule", "rule {rule}");
        stat.leaf("description", "description {value}");
        stat.leaf("destination.address", "destination address {value}");
        stat.leaf("inbound-interface", "inbound-interface {value}");
        stat.leaf("translation.address", "translation address {value}");
    }

    // fields shared by source and destination NAT
    private static void translatedRule(GrammarBuilder rule) {
        rule.leaf("packet-type", "packet-type {value}");
        rule.leaf("description", "description {value}");
        rule.presence("disable", "disable");
        rule.presence("exclude", "exclude");
        rule.presence("log", "log");
        rule.leaf("protocol", "protocol {value}");
        rule.leaf("load-balance.hash", "load-balance hash {value}");
        rule.multi("load-balance.backend", "load-balance backend {value}");
        rule.leaf("translation.address", "translation address {value}");

        for (String side : new String[]{"source", "destination"}) {
            rule.leaf(side + ".address", side + " address {value}");
            rule.leaf(side + ".port", side + " port {value}");
            rule.leaf(side + ".group", side + " group {type} {value}")
                    .allow(side + ".group", "type", GROUP_TYPES);
        }
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4, V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("source", "Source NAT (SNAT) and Masquerade")
                .always("destination", "Destination NAT (DNAT) for port forwarding")
                .always("static", "Static 1:1 NAT mapping");
    }
}
