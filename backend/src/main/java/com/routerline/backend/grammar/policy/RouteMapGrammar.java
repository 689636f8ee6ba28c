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
 * {@code policy route-map <map> rule <rule>}. Operation names mirror the command words, so
 * {@code match ip address prefix-list} is {@code map.rule.match.ip.address.prefix-list}.
 */
public class RouteMapGrammar extends FeatureGrammar {

    private static final List<String> VALUED = List.of(
            "description",
            "call",
            "continue",
            "on-match goto",
            "match as-path",
            "match community community-list",
            "match extcommunity",
            "match large-community large-community-list",
            "match local-preference",
            "match metric",
            "match origin",
            "match peer",
            "match rpki",
            "match ip address access-list",
            "match ip address prefix-list",
            "match ip address prefix-len",
            "match ipv6 address access-list",
            "match ipv6 address prefix-list",
            "match ipv6 address prefix-len",
            "match ip nexthop access-list",
            "match ip nexthop address",
            "match ip nexthop prefix-len",
            "match ip nexthop prefix-list",
            "match ip nexthop type",
            "match ipv6 nexthop address",
            "match ipv6 nexthop access-list",
            "match ipv6 nexthop prefix-len",
            "match ipv6 nexthop prefix-list",
            "match ipv6 nexthop type",
            "match ip route-source access-list",
            "match ip route-source prefix-list",
            "match interface",
            "match protocol",
            "match source-vrf",
            "match tag",
            "set as-path exclude",
            "set as-path prepend",
            "set as-path prepend-last-as",
            "set community add",
            "set community replace",
            "set community delete",
            "set large-community add",
            "set large-community replace",
            "set large-community delete",
            "set extcommunity bandwidth",
            "set extcommunity rt",
            "set extcommunity soo",
            "set aggregator as",
            "set aggregator ip",
            "set local-preference",
            "set origin",
            "set originator-id",
            "set weight",
            "set ip-next-hop",
            "set ipv6-next-hop global",
            "set ipv6-next-hop local",
            "set distance",
            "set metric",
            "set metric-type",
            "set src",
            "set table",
            "set tag"
    );

    private static final List<String> FLAGS = List.of(
            "on-match next",
            "match community exact-match",
            "match large-community exact-match",
            "set community none",
            "set large-community none",
            "set extcommunity none",
            "set atomic-aggregate",
            "set ip-next-hop peer-address",
            "set ip-next-hop unchanged",
            "set ipv6-next-hop peer-address",
            "set ipv6-next-hop prefer-global"
    );

    @Override
    public FeatureFamily family() { return FeatureFamily.ROUTE_MAP; }

    @Override
    protected void define(GrammarBuilder g) {
        GrammarBuilder map = g.node("map", "policy route-map {map}");
        map.leaf("description", "description {value}");

        GrammarBuilder rule = map.node("rule", "rule {rule}");
        rule.leaf("action", "action {value}").allow("action", "value", AccessListGrammar.ACTIONS);
        rule.node("match", "match");
        rule.node("set", "set");
        for (String words : VALUED) rule.leaf(opName(words), words + " {value}");
        for (String words : FLAGS) rule.presence(opName(words), words);
        rule.allow("match.origin", "value", "egp", "igp", "incomplete")
                .allow("match.rpki", "value", "invalid", "notfound", "valid")
                .allow("set.origin", "value", "egp", "igp", "incomplete");
    }

    private static String opName(String words) {
        return words.replace(' ', '.');
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4, V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("basic", "Basic route-map configuration")
                .always("rules", "Route-map rules with permit/deny actions")
                .always("match_conditions", "Match on prefix lists, access lists, communities and route attributes")
                .always("set_actions", "Modify route attributes")
                .always("bgp_attributes", "BGP specific attributes (AS path, communities, local preference)")
                .always("call_continue", "Call other route-maps and continue to rules")
                .always("on_match", "On-match goto and next actions");
    }
}
