package com.routerline.backend.grammar.dhcp;

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
 * {@code service dhcp-server}. Subnet operations take {@code network} and {@code subnet}, e.g.
 * {@code shared-network.subnet.default-router}.
 * <p>
 * 1.5 moved the client options under an {@code option} node and added {@code subnet-id}.
 */
public class DhcpGrammar extends FeatureGrammar {

    private static final String PREFIX = "service dhcp-server";
    private static final String SUBNET = PREFIX + " shared-network-name {network} subnet {subnet}";
    private static final String SUBNET_OPS = "shared-network.subnet.";

    // option leaf -> multi-valued
    private static final Map<String, Boolean> OPTIONS = new LinkedHashMap<>();
    static {
        OPTIONS.put("default-router", false);
        OPTIONS.put("name-server", true);
        OPTIONS.put("domain-name", false);
        OPTIONS.put("domain-search", true);
        OPTIONS.put("bootfile-name", false);
        OPTIONS.put("bootfile-server", false);
        OPTIONS.put("tftp-server-name", false);
        OPTIONS.put("time-server", true);
        OPTIONS.put("ntp-server", true);
        OPTIONS.put("wins-server", true);
        OPTIONS.put("time-offset", false);
    }

    @Override
    public FeatureFamily family() { return FeatureFamily.DHCP; }

    @Override
    protected void define(GrammarBuilder g) {
        GrammarBuilder server = g.scope("server", PREFIX);
        server.multi("listen-address", "listen-address {value}");
        server.presence("hostfile-update", "hostfile-update");
        server.presence("host-decl-name", "host-decl-name");

        GrammarBuilder network = g.node("shared-network", PREFIX + " shared-network-name {network}");
        network.presence("authoritative", "authoritative");
        network.multi("name-server", "name-server {value}");
        network.leaf("domain-name", "domain-name {value}");
        network.multi("domain-search", "domain-search {value}");
        network.presence("ping-check", "ping-check");

        GrammarBuilder subnet = network.node("subnet", "subnet {subnet}");
        subnet.leaf("subnet-id", "subnet-id {value}");
        subnet.leaf("lease", "lease {value}");
        subnet.multi("exclude", "exclude {value}");
        subnet.presence("ping-check", "ping-check");
        subnet.leaf("client-prefix-length", "client-prefix-length {value}");
        subnet.leaf("wpad-url", "wpad-url {value}");
        subnet.presence("enable-failover", "enable-failover");

        GrammarBuilder range = subnet.node("range", "range {range}");
        range.leaf("start", "start {value}");
        range.leaf("stop", "stop {value}");

        GrammarBuilder mapping = subnet.node("static-mapping", "static-mapping {mapping}");
        mapping.leaf("ip-address", "ip-address {value}");
        mapping.leaf("mac-address", "mac-address {value}");
        mapping.presence("disable", "disable");

        for (var e : OPTIONS.entrySet()) {
            String template = "option " + e.getKey() + " {value}";
            if (e.getValue()) subnet.multi(e.getKey(), template);
            else subnet.leaf(e.getKey(), template);
        }

        GrammarBuilder ha = g.scope("high-availability", PREFIX + " high-availability");
        for (String leaf : new String[]{"mode", "name", "source-address", "remote", "status"}) {
            ha.leaf(leaf, leaf + " {value}");
        }
    }

    @Override
    protected Map<String, OperationSpec> overrides(VersionTag version, GrammarOverrides o) {
        return switch (version) {
            case V1_4 -> {
                for (String option : OPTIONS.keySet()) {
                    o.reshape(SUBNET_OPS + option, SUBNET + " " + option + " {value}");
                }
                yield o.absent(SUBNET_OPS + "subnet-id")
                        .unsupported(SUBNET_OPS + "time-offset", "DHCP time-offset requires VyOS 1.5+")
                        .build();
            }
            case V1_5 -> o.unsupported(SUBNET_OPS + "enable-failover", "Subnet enable-failover was removed in VyOS 1.5")
                    .build();
        };
    }

    @Override
    protected void describe(CapabilityTable t) {
        t.always("subnet", "Subnet CIDR (e.g., 192.168.1.0/24)")
                .since(VersionTag.V1_5, "subnet_id", "Subnet ID (VyOS 1.5+ required)")
                .always("default_router", "Default gateway for clients")
                .always("domain_name", "Domain name for DHCP clients")
                .always("lease", "Lease time in seconds")
                .always("name_servers", "DNS server addresses")
                .always("domain_search", "DNS search domains")
                .always("ranges", "DHCP IP address ranges")
                .always("excludes", "IP addresses to exclude from pool")
                .always("bootfile_name", "Boot file name for PXE clients")
                .always("bootfile_server", "Boot server IP address")
                .always("tftp_server_name", "TFTP server hostname")
                .always("time_servers", "Time server addresses")
                .always("ntp_servers", "NTP server addresses")
                .since(VersionTag.V1_5, "time_offset", "Time offset in seconds (VyOS 1.5+)")
                .always("wins_servers", "WINS server addresses")
                .always("client_prefix_length", "Client prefix length for IPv4")
                .always("wpad_url", "Web Proxy Auto-Discovery URL")
                .always("ping_check", "Test IP with ping before assignment")
                .only(VersionTag.V1_4, "enable_failover", "High availability failover (VyOS 1.4 only)")
                // version notes
                .since(VersionTag.V1_5, "subnet_id_required", "Every subnet needs a subnet-id")
                .since(VersionTag.V1_5, "option_prefix", "Client options are set under the option node")
                .since(VersionTag.V1_5, "subnet_failover_removed", "Per-subnet enable-failover no longer exists")
                .since(VersionTag.V1_5, "time_offset_requires_option_prefix", "time-offset is only available as an option");
    }
}
