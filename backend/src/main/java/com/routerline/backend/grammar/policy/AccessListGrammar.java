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
 * {@code policy access-list <number>} under {@code ipv4.*} and {@code policy access-list6 <name>} under
 * {@code ipv6.*}. Both take {@code list}; rule operations also take {@code rule}.
 */
public class AccessListGrammar extends FeatureGrammar {

    static final String[] ACTIONS = {"permit", "deny"};

    @Override
    public FeatureFamily family() { return FeatureFamily.ACCESS_LIST; }

    @Override
    protected void define(GrammarBuilder g) {
        GrammarBuilder v4 = g.node("ipv4", "policy access-list {list}");
        v4.leaf("description", "description {value}");
        GrammarBuilder rule4 = ruleHead(v4);
        for (String side : new String[]{"source", "destination"}) {
            rule4.node(side, side);
            rule4.presence(side + ".any", side + " any");
            rule4.leaf(side + ".host", side + " host {value}");
            // wildcard form: network first, then its inverse mask
            rule4.compound(side + ".inverse-mask",
                    List.of(side + " network {network}", side + " inverse-mask {mask}"),
                    List.of(side + " network", side + " inverse-mask"));
            rule4.compound(side + ".network",
                    List.of(side + " network {network} {mask}"),
                    List.of(side + " network"));
        }

        GrammarBuilder v6 = g.node("ipv6", "policy access-list6 {list}");
        v6.leaf("description", "description {value}");
        GrammarBuilder rule6 = ruleHead(v6);
        for (String side : new String[]{"source", "destination"}) {
            rule6.node(side, side);
            rule6.presence(side + ".any", side + " any");
            rule6.leaf(side + ".network", side + " network {value}");
        }
    }

    private static GrammarBuilder ruleHead(GrammarBuilder list) {
        GrammarBuilder rule = list.node("rule", "rule {rule}");
        rule.leaf("action", "action {value}").allow("action", "value", ACTIONS);
        rule.leaf("description", "description {value}");
        return rule;
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4, V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("ipv4_access_list", "IPv4 access lists (numbered)")
                .always("ipv6_access_list", "IPv6 access lists (named)")
                .always("source_destination_filters", "Source/destination any, host, network and inverse-mask filters");
    }
}
