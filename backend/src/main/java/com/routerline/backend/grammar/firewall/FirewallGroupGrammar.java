package com.routerline.backend.grammar.firewall;

import com.routerline.backend.compiler.CapabilityTable;
import com.routerline.backend.compiler.FeatureFamily;
import com.routerline.backend.compiler.FeatureGrammar;
import com.routerline.backend.compiler.GrammarBuilder;
import com.routerline.backend.compiler.GrammarOverrides;
import com.routerline.backend.compiler.OperationSpec;
import com.routerline.backend.compiler.VersionTag;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code firewall group <type> <name>}. Operations are named after the group type:
 * {@code address-group}, {@code address-group.description}, {@code address-group.address}, ...
 * Every operation takes {@code name}; member and description operations also take {@code value}.
 */
public class FirewallGroupGrammar extends FeatureGrammar {

    static final String DOMAIN_GROUPS_NEED_1_5 = "Domain groups require VyOS 1.5+";
    static final String REMOTE_GROUPS_NEED_1_5 = "Remote groups require VyOS 1.5+";

    // group type -> member leaf
    private static final Map<String, String> MEMBERS = new LinkedHashMap<>();
    static {
        MEMBERS.put("address-group", "address");
        MEMBERS.put("ipv6-address-group", "address");
        MEMBERS.put("network-group", "network");
        MEMBERS.put("ipv6-network-group", "network");
        MEMBERS.put("port-group", "port");
        MEMBERS.put("interface-group", "interface");
        MEMBERS.put("mac-group", "mac-address");
        MEMBERS.put("domain-group", "address");
        MEMBERS.put("remote-group", "url");
    }

    @Override
    public FeatureFamily family() { return FeatureFamily.FIREWALL_GROUPS; }

    @Override
    protected void define(GrammarBuilder g) {
        for (var e : MEMBERS.entrySet()) {
            String type = e.getKey();
            String member = e.getValue();
            GrammarBuilder group = g.node(type, "firewall group " + type + " {name}");
            group.leaf("description", "description {value}");
            group.multi(member, member + " {value}");
        }
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4 -> o.unsupported("domain-group", DOMAIN_GROUPS_NEED_1_5)
                    .unsupported("remote-group", REMOTE_GROUPS_NEED_1_5)
                    .build();
            case V1_5 -> o.build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("address_group", "IPv4 address group")
                .always("ipv6_address_group", "IPv6 address group")
                .always("network_group", "IPv4 network group")
                .always("ipv6_network_group", "IPv6 network group")
                .always("port_group", "Port group (TCP/UDP ports)")
                .always("interface_group", "Interface group")
                .always("mac_group", "MAC address group")
                .since(VersionTag.V1_5, "domain_group", "Domain name group (1.5+)")
                .since(VersionTag.V1_5, "remote_group", "Remote address group (1.5+)");
    }
}
