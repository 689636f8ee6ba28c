package com.routerline.backend.grammar.policy;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.Map;

/**
 * Regex-matched BGP lists: as-path, community, extcommunity and large-community. They share one shape,
 * {@code policy <kind> {list} rule {rule} action|description|regex}, so a single grammar serves all four.
 */
public class BgpListGrammar extends FeatureGrammar {

    private final FeatureFamily family;
    private final String node;
    private final String label;

    private BgpListGrammar(FeatureFamily family, String node, String label) {
        this.family = family;
        this.node = node;
        this.label = label;
    }

    public static BgpListGrammar asPath() {
        return new BgpListGrammar(FeatureFamily.AS_PATH_LIST, "as-path-list", "AS path list");
    }

    public static BgpListGrammar community() {
        return new BgpListGrammar(FeatureFamily.COMMUNITY_LIST, "community-list", "Community list");
    }

    public static BgpListGrammar extcommunity() {
        return new BgpListGrammar(FeatureFamily.EXTCOMMUNITY_LIST, "extcommunity-list", "Extended community list");
    }

    public static BgpListGrammar largeCommunity() {
        return new BgpListGrammar(FeatureFamily.LARGE_COMMUNITY_LIST, "large-community-list", "Large community list");
    }

    @Override
    public FeatureFamily family() { return family; }

    @Override
    protected void define(GrammarBuilder g) {
        GrammarBuilder list = g.node("list", "policy " + node + " {list}");
        list.leaf("description", "description {value}");
        GrammarBuilder rule = list.node("rule", "rule {rule}");
        rule.leaf("action", "action {value}").allow("action", "value", AccessListGrammar.ACTIONS);
        rule.leaf("description", "description {value}");
        rule.leaf("regex", "regex {value}");
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4, V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("basic", "Basic " + lower(label) + " configuration")
                .always("rules", label + " rules with regex patterns")
                .always("actions", "Permit/deny actions for rules");
    }

    private static String lower(String s) {
        return s.startsWith("AS") ? s : Character.toLowerCase(s.charAt(0)) + s.substring(1);
    }
}
