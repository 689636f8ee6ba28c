package com.routerline.backend.grammar.policy;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.Map;

/** {@code policy prefix-list <list>} ({@code ipv4.*}) and {@code policy prefix-list6 <list>} ({@code ipv6.*}). */
public class PrefixListGrammar extends FeatureGrammar {

    @Override
    public FeatureFamily family() { return FeatureFamily.PREFIX_LIST; }

    @Override
    protected void define(GrammarBuilder g) {
        list(g.node("ipv4", "policy prefix-list {list}"));
        list(g.node("ipv6", "policy prefix-list6 {list}"));
    }

    private static void list(GrammarBuilder list) {
        list.leaf("description", "description {value}");
        GrammarBuilder rule = list.node("rule", "rule {rule}");
        rule.leaf("action", "action {value}").allow("action", "value", AccessListGrammar.ACTIONS);
        rule.leaf("description", "description {value}");
        rule.leaf("prefix", "prefix {value}");
        rule.leaf("ge", "ge {value}");
        rule.leaf("le", "le {value}");
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4, V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("ipv4_prefix_lists", "IPv4 prefix lists")
                .always("ipv6_prefix_lists", "IPv6 prefix lists")
                .always("ge_le_operators", "Greater-than-or-equal and less-than-or-equal prefix length matching")
                .always("rule_descriptions", "Per-rule descriptions");
    }
}
