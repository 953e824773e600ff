package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.catalog.ConnectionHealth;
import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.DxVirtualInterface;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.Severity;
import com.sparrowlogic.networktopology.model.Subnet;
import com.sparrowlogic.networktopology.model.SubnetClass;
import com.sparrowlogic.networktopology.model.TgwAttachment;
import com.sparrowlogic.networktopology.model.TgwRouteTable;
import com.sparrowlogic.networktopology.model.Vpc;
import com.sparrowlogic.networktopology.model.VpcRouteTable;
import com.sparrowlogic.networktopology.model.VpnConnection;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders an {@link AnalysisResult} as a Markdown summary followed by detail tables for route
 * tables, attachments, VPCs and hybrid connections.
 */
@Service
public class ReportService {

    private static final String NONE = "-";

    public String generateReport(AnalysisResult result) {
        var catalog = result.catalog();
        var report = new StringBuilder("# Network Topology Report\n\n");

        report.append("**Account:** ").append(catalog.getLocalAccountId().isEmpty() ? "unknown" : catalog.getLocalAccountId())
              .append(" (").append(accountMode(catalog)).append(")\n\n");

        if (catalog.isSpoke()) {
            report.append("Attached to Transit Gateway(s) owned by another account:\n\n");
            catalog.referencedTgwIds().forEach(id -> report.append("- ").append(id).append("\n"));
            report.append("\n");
        }

        report.append("## Resources\n\n");
        report.append("- Transit Gateways: ").append(catalog.getTransitGateways().size()).append("\n");
        report.append("- TGW route tables: ").append(catalog.getTgwRouteTables().size()).append("\n");
        report.append("- TGW attachments: ").append(catalog.getTgwAttachments().size())
              .append(" (").append(catalog.crossAccountAttachments().size()).append(" cross-account)\n");
        report.append("- VPCs: ").append(catalog.getVpcs().size()).append("\n");
        report.append("- Subnets: ").append(catalog.getSubnets().size()).append("\n");
        report.append("- VPC peerings: ").append(catalog.getPeerings().size()).append("\n");
        report.append("- VPN connections: ").append(catalog.getVpnConnections().size()).append("\n");
        report.append("- Direct Connect connections: ").append(catalog.getDxConnections().size()).append("\n");
        report.append("- Direct Connect virtual interfaces: ").append(catalog.getDxVirtualInterfaces().size()).append("\n\n");

        var crossAccount = catalog.crossAccountAttachments();
        if (!crossAccount.isEmpty()) {
            report.append("## Cross-Account Attachments\n\n");
            for (var att : crossAccount) {
                var cidrs = att.getCidrs().isEmpty() ? "no CIDRs propagated" : String.join(", ", att.getCidrs());
                report.append("- ").append(att.displayName()).append(" (").append(att.getType().value())
                      .append(", account ").append(att.getResourceOwnerId()).append("): ").append(cidrs).append("\n");
            }
            report.append("\n");
        }

        appendTgwRouteTables(report, catalog);
        appendAttachments(report, catalog);
        appendVpcs(report, catalog);
        appendVpnConnections(report, catalog);
        appendDirectConnect(report, catalog);

        if (!catalog.getSubnets().isEmpty()) {
            var counts = catalog.getSubnets().values().stream()
                .collect(Collectors.groupingBy(Subnet::getSubnetClass, () -> new EnumMap<>(SubnetClass.class),
                    Collectors.counting()));
            report.append("## Subnets\n\n");
            counts.forEach((subnetClass, count) ->
                report.append("- ").append(subnetClass.label()).append(": ").append(count).append("\n"));
            report.append("\n");
        }

        report.append("## Findings\n\n");
        if (result.findings().isEmpty()) {
            report.append("No issues found.\n");
            return report.toString();
        }
        for (var severity : List.of(Severity.ERROR, Severity.WARNING, Severity.INFO)) {
            var matching = result.findings().stream().filter(f -> f.severity() == severity).toList();
            if (matching.isEmpty()) {
                continue;
            }
            report.append("### ").append(heading(severity)).append(" (").append(matching.size()).append(")\n\n");
            for (Finding finding : matching) {
                report.append("- **").append(finding.kind().code()).append("** ").append(finding.message()).append("\n");
            }
            report.append("\n");
        }
        return report.toString();
    }

    public static String accountMode(NetworkCatalog catalog) {
        if (catalog.isHub()) {
            return "Hub";
        }
        return catalog.isSpoke() ? "Spoke" : "Standalone";
    }

    private void appendTgwRouteTables(StringBuilder report, NetworkCatalog catalog) {
        if (catalog.getTgwRouteTables().isEmpty()) {
            return;
        }
        report.append("## Transit Gateway Route Tables\n\n");
        for (var rt : catalog.getTgwRouteTables().values()) {
            report.append("### ").append(rt.displayName()).append(" (").append(rt.getId()).append(")\n\n");

            var meta = new ArrayList<String>();
            if (rt.isDefaultAssociation()) {
                meta.add("Default association");
            }
            if (rt.isDefaultPropagation()) {
                meta.add("Default propagation");
            }
            meta.add("Associated: " + attachmentNames(catalog, rt.getAssociations()));
            meta.add("Propagations: " + attachmentNames(catalog, rt.getPropagations()));
            report.append(String.join("; ", meta)).append("\n\n");

            if (rt.getRoutes().isEmpty()) {
                report.append("No routes visible.\n\n");
                continue;
            }
            row(report, "State", "Destination", "Attachment", "Target", "Owner", "Resource Type", "Route Type");
            separator(report, 7);
            for (var route : rt.getRoutes()) {
                var att = route.attachmentId() == null ? null : catalog.getTgwAttachments().get(route.attachmentId());
                row(report,
                    route.isBlackhole() ? "blackhole" : "active",
                    withPrefixListName(catalog, route.destination()),
                    orNone(route.attachmentId()),
                    att == null ? NONE : att.displayName(),
                    att == null ? NONE : owner(att),
                    orNone(route.resourceType()),
                    route.isPropagated() ? "propagated" : "static");
            }
            report.append("\n");
        }
    }

    private void appendAttachments(StringBuilder report, NetworkCatalog catalog) {
        if (catalog.getTgwAttachments().isEmpty()) {
            return;
        }
        var sorted = catalog.getTgwAttachments().values().stream()
            .sorted(Comparator.comparing((TgwAttachment a) -> !a.isCrossAccount())
                .thenComparing(a -> a.getType().value())
                .thenComparing(a -> a.getName().isBlank() ? a.getId() : a.getName()))
            .toList();

        report.append("## Attachments\n\n");
        row(report, "Name", "Attachment", "Type", "Owner", "State", "CIDRs", "Associated Route Table", "Propagates To");
        separator(report, 8);
        for (var att : sorted) {
            String cidrs;
            if (!att.getCidrs().isEmpty()) {
                cidrs = String.join(", ", att.getCidrs());
            } else {
                cidrs = att.isCrossAccount() ? "not visible (cross-account)" : NONE;
            }
            String associated;
            if (att.getAssociatedRouteTableId() != null) {
                associated = routeTableName(catalog, att.getAssociatedRouteTableId());
            } else {
                associated = catalog.isSpoke() ? "not visible" : NONE;
            }
            var propagations = att.getPropagatingTo().stream().map(id -> routeTableName(catalog, id)).toList();
            row(report, att.displayName(), att.getId(), att.getType().value(), owner(att), orNone(att.getState()),
                cidrs, associated, propagations.isEmpty() ? NONE : String.join(", ", propagations));
        }
        report.append("\n");
    }

    private void appendVpcs(StringBuilder report, NetworkCatalog catalog) {
        if (catalog.getVpcs().isEmpty()) {
            return;
        }
        report.append("## VPCs\n\n");
        for (var vpc : catalog.getVpcs().values()) {
            report.append("### ").append(vpc.displayName()).append(" (").append(vpc.getId()).append(")\n\n");
            report.append("CIDRs: ").append(vpc.getCidrs().isEmpty() ? NONE : String.join(", ", vpc.getCidrs()))
                  .append(". Gateways: ").append(gateways(vpc)).append(".\n\n");

            var subnets = catalog.getSubnets().values().stream()
                .filter(s -> s.getVpcId().equals(vpc.getId()))
                .sorted(Comparator.comparing(Subnet::getAvailabilityZone).thenComparing(Subnet::getCidr))
                .toList();
            if (subnets.isEmpty()) {
                report.append("No subnets.\n\n");
            } else {
                row(report, "Class", "Subnet", "CIDR", "AZ", "Route Table");
                separator(report, 5);
                for (var subnet : subnets) {
                    var subnetName = subnet.getName().isBlank()
                        ? subnet.getId() : subnet.getName() + " (" + subnet.getId() + ")";
                    row(report, subnet.getSubnetClass().label(), subnetName, subnet.getCidr(),
                        orNone(subnet.getAvailabilityZone()), subnetRouteTable(catalog, vpc, subnet));
                }
                report.append("\n");
            }

            for (var rt : catalog.routeTablesOfVpc(vpc.getId())) {
                appendVpcRouteTable(report, catalog, rt);
            }
        }
    }

    private void appendVpcRouteTable(StringBuilder report, NetworkCatalog catalog, VpcRouteTable rt) {
        var label = rt.getName().isBlank() ? rt.getId() : rt.getName() + " / " + rt.getId();
        report.append("**Route table ").append(label).append("**");
        if (rt.isMain()) {
            report.append(" (main)");
        }
        report.append(": ").append(rt.getRoutes().size()).append(" route(s)\n\n");
        if (rt.getRoutes().isEmpty()) {
            return;
        }
        row(report, "Destination", "Target", "Target ID", "State");
        separator(report, 4);
        for (var route : rt.getRoutes()) {
            row(report, withPrefixListName(catalog, route.destination()),
                route.targetType().label().toUpperCase(Locale.ROOT), orNone(route.targetId()),
                route.isBlackhole() ? "blackhole" : "active");
        }
        report.append("\n");
    }

    private void appendVpnConnections(StringBuilder report, NetworkCatalog catalog) {
        if (catalog.getVpnConnections().isEmpty()) {
            return;
        }
        report.append("## VPN Connections\n\n");
        for (var vpn : catalog.getVpnConnections().values()) {
            var cgw = catalog.getCustomerGateways().get(vpn.customerGatewayId());
            report.append("- ").append(vpn.displayName()).append(": ").append(ConnectionHealth.tunnelSummary(vpn));
            if (cgw != null && !cgw.ipAddress().isEmpty()) {
                report.append(", customer gateway ").append(cgw.ipAddress());
            }
            report.append("\n");
        }
        report.append("\n");

        for (var vpn : catalog.getVpnConnections().values()) {
            appendTunnels(report, vpn);
        }
    }

    private void appendTunnels(StringBuilder report, VpnConnection vpn) {
        report.append("### Tunnels: ").append(vpn.displayName()).append("\n\n");
        report.append("State: ").append(orNone(vpn.state()))
              .append(". Routing: ").append(vpn.staticRoutesOnly() ? "static" : "BGP");
        if (vpn.accelerationEnabled()) {
            report.append(", accelerated");
        }
        report.append(".");
        if (!vpn.routes().isEmpty()) {
            report.append(" Routes: ").append(String.join(", ", vpn.routes())).append(".");
        }
        report.append("\n\n");

        if (vpn.tunnels().isEmpty()) {
            report.append("No tunnel telemetry.\n\n");
            return;
        }
        row(report, "Tunnel", "Outside IP", "Status", "Accepted Routes", "Message");
        separator(report, 5);
        for (var i = 0; i < vpn.tunnels().size(); i++) {
            var tunnel = vpn.tunnels().get(i);
            row(report, "Tunnel " + (i + 1), orNone(tunnel.outsideIp()), tunnel.status(),
                String.valueOf(tunnel.acceptedRouteCount()), orNone(tunnel.statusMessage()));
        }
        report.append("\n");
    }

    private void appendDirectConnect(StringBuilder report, NetworkCatalog catalog) {
        if (catalog.getDxConnections().isEmpty() && catalog.getDxVirtualInterfaces().isEmpty()) {
            return;
        }
        report.append("## Direct Connect\n\n");
        for (var connection : catalog.getDxConnections().values()) {
            report.append("- Connection ").append(connection.displayName()).append(" (").append(connection.state())
                  .append("): ").append(orNone(connection.bandwidth())).append(" at ").append(orNone(connection.location()))
                  .append("\n");
        }
        for (var vif : catalog.getDxVirtualInterfaces().values()) {
            var connection = catalog.getDxConnections().get(vif.connectionId());
            report.append("- ").append(vif.displayName()).append(" (").append(vif.state()).append("): ")
                  .append(ConnectionHealth.bgpSummary(vif));
            if (connection != null && !connection.location().isEmpty()) {
                report.append(" at ").append(connection.location());
            }
            report.append("\n");
        }
        report.append("\n");

        for (var vif : catalog.getDxVirtualInterfaces().values()) {
            appendBgpPeers(report, vif);
        }
    }

    private void appendBgpPeers(StringBuilder report, DxVirtualInterface vif) {
        report.append("### BGP peers: ").append(vif.displayName()).append("\n\n");
        report.append(orNone(vif.vifType())).append(" VIF, VLAN ").append(vif.vlan())
              .append(", customer ASN ").append(vif.customerAsn())
              .append(", Amazon ASN ").append(vif.amazonAsn())
              .append(", MTU ").append(vif.mtu()).append("\n\n");

        if (vif.bgpPeers().isEmpty()) {
            report.append("No BGP peers.\n\n");
            return;
        }
        row(report, "Peer ASN", "Customer Address", "Amazon Address", "Status");
        separator(report, 4);
        for (var peer : vif.bgpPeers()) {
            row(report, String.valueOf(peer.asn()), orNone(peer.customerAddress()), orNone(peer.amazonAddress()),
                orNone(peer.bgpStatus()).toUpperCase(Locale.ROOT));
        }
        report.append("\n");
    }

    private static String attachmentNames(NetworkCatalog catalog, Collection<String> attachmentIds) {
        if (attachmentIds.isEmpty()) {
            return "none";
        }
        return attachmentIds.stream()
            .map(id -> {
                var att = catalog.getTgwAttachments().get(id);
                return att == null ? id : att.displayName();
            })
            .collect(Collectors.joining(", "));
    }

    private static String routeTableName(NetworkCatalog catalog, String routeTableId) {
        TgwRouteTable rt = catalog.getTgwRouteTables().get(routeTableId);
        return rt == null ? routeTableId : rt.displayName();
    }

    private static String subnetRouteTable(NetworkCatalog catalog, Vpc vpc, Subnet subnet) {
        if (subnet.getRouteTableId() != null) {
            var rt = catalog.getVpcRouteTables().get(subnet.getRouteTableId());
            return rt == null ? subnet.getRouteTableId() : rt.displayName();
        }
        var main = vpc.getMainRouteTableId() == null ? null : catalog.getVpcRouteTables().get(vpc.getMainRouteTableId());
        return main == null ? NONE : main.displayName() + " (main)";
    }

    private static String gateways(Vpc vpc) {
        var features = new ArrayList<String>();
        if (vpc.getIgwId() != null) {
            features.add("IGW");
        }
        if (!vpc.getNatGatewayIds().isEmpty()) {
            features.add(vpc.getNatGatewayIds().size() + " NAT");
        }
        if (vpc.getTgwAttachmentId() != null) {
            features.add("TGW");
        }
        return features.isEmpty() ? "none" : String.join(", ", features);
    }

    private static String withPrefixListName(NetworkCatalog catalog, String destination) {
        if (destination != null && destination.startsWith("pl-") && catalog.getPrefixLists().containsKey(destination)) {
            return destination + " (" + catalog.prefixListName(destination) + ")";
        }
        return orNone(destination);
    }

    /**
     * Cross-account owners are shown in full, local ones by their last four digits.
     */
    private static String owner(TgwAttachment att) {
        var ownerId = att.getResourceOwnerId();
        if (ownerId == null || ownerId.isEmpty()) {
            return NONE;
        }
        if (att.isCrossAccount()) {
            return "🔗 " + ownerId;
        }
        return "..." + (ownerId.length() > 4 ? ownerId.substring(ownerId.length() - 4) : ownerId);
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? NONE : value;
    }

    private static void row(StringBuilder report, String... cells) {
        report.append("|");
        for (var cell : cells) {
            report.append(" ").append(cell.replace("|", "\\|").replace('\n', ' ')).append(" |");
        }
        report.append("\n");
    }

    private static void separator(StringBuilder report, int columns) {
        report.append("|---".repeat(columns)).append("|\n");
    }

    private static String heading(Severity severity) {
        return switch (severity) {
            case ERROR -> "Errors";
            case WARNING -> "Warnings";
            case INFO -> "Info";
        };
    }
}
