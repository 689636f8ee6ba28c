package com.routerline.backend.grammar.policy;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.Map;

/** {@code policy local-route rule <rule>} ({@code ipv4.rule.*}) and {@code policy local-route6} ({@code ipv6.rule.*}). */
public class LocalRouteGrammar extends FeatureGrammar {

    @Override
    public FeatureFamily family() { return FeatureFamily.LOCAL_ROUTE; }

    @Override
    protected void define(GrammarBuilder g) {
        rule(g.scope("ipv4", "policy local-route").node("rule", "rule {rule}"));
        rule(g.scope("ipv6", "policy local-route6").node("rule", "rule {rule}"));
    }

    private static void rule(GrammarBuilder rule) {
        rule.node("source", "source");
        rule.multi("source.address", "source address {value}");
        rule.node("destination", "destination");
        rule.multi("destination.address", "destination address {value}");
        rule.leaf("inbound-interface", "inbound-interface {value}");
        rule.leaf("set.table", "set table {value}");
        rule.leaf("set.vrf", "set vrf {value}");
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4 -> o
                    .unsupported(n -> n.endsWith(".set.vrf"), "Local-route VRF selection requires VyOS 1.5+", "set.vrf")
                    .build();
            case V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("ipv4_local_route", "IPv4 local route policies")
                .always("ipv6_local_route", "IPv6 local route policies")
                .always("source_matching", "Match on source address")
                .always("destination_matching", "Match on destination address")
                .always("inbound_interface_matching", "Match on inbound interface")
                .always("routing_table_selection", "Select routing table")
                .since(VersionTag.V1_5, "vrf_support", "Select VRF (VyOS 1.5+)");
    }
}
