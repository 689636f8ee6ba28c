package com.routerline.backend.grammar;

import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.grammar.dhcp.DhcpGrammar;
import com.routerline.backend.grammar.firewall.FirewallGroupGrammar;
import com.routerline.backend.grammar.firewall.FirewallRuleGrammar;
import com.routerline.backend.grammar.nat.NatGrammar;
import com.routerline.backend.grammar.policy.AccessListGrammar;
import com.routerline.backend.grammar.policy.BgpListGrammar;
import com.routerline.backend.grammar.policy.LocalRouteGrammar;
import com.routerline.backend.grammar.policy.PolicyRouteGrammar;
import com.routerline.backend.grammar.policy.PrefixListGrammar;
import com.routerline.backend.grammar.policy.RouteMapGrammar;
import com.routerline.backend.grammar.routing.StaticRouteGrammar;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class GrammarConfig {

    /** Every family the compiler knows, for wiring without a Spring context. */
    public static List<FeatureGrammar> all() {
        GrammarConfig c = new GrammarConfig();
        return List.of(
                c.firewallGroups(), c.firewallIpv4(), c.firewallIpv6(), c.nat(), c.dhcp(),
                c.accessList(), c.prefixList(),
                c.asPathList(), c.communityList(), c.extcommunityList(), c.largeCommunityList(),
                c.routeMap(), c.staticRoutes(), c.localRoute(), c.policyRoute()
        );
    }

    @Bean
    public FeatureGrammar firewallGroups() { return new FirewallGroupGrammar(); }

    @Bean
    public FeatureGrammar firewallIpv4() { return FirewallRuleGrammar.ipv4(); }

    @Bean
    public FeatureGrammar firewallIpv6() { return FirewallRuleGrammar.ipv6(); }

    @Bean
    public FeatureGrammar nat() { return new NatGrammar(); }

    @Bean
    public FeatureGrammar dhcp() { return new DhcpGrammar(); }

    @Bean
    public FeatureGrammar accessList() { return new AccessListGrammar(); }

    @Bean
    public FeatureGrammar prefixList() { return new PrefixListGrammar(); }

    @Bean
    public FeatureGrammar asPathList() { return BgpListGrammar.asPath(); }

    @Bean
    public FeatureGrammar communityList() { return BgpListGrammar.community(); }

    @Bean
    public FeatureGrammar extcommunityList() { return BgpListGrammar.extcommunity(); }

    @Bean
    public FeatureGrammar largeCommunityList() { return BgpListGrammar.largeCommunity(); }

    @Bean
    public FeatureGrammar routeMap() { return new RouteMapGrammar(); }

    @Bean
    public FeatureGrammar staticRoutes() { return new StaticRouteGrammar(); }

    @Bean
    public FeatureGrammar localRoute() { return new LocalRouteGrammar(); }

    @Bean
    public FeatureGrammar policyRoute() { return new PolicyRouteGrammar(); }
}
