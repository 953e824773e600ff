package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.config.TopologyProperties;
import com.sparrowlogic.networktopology.model.AttachmentType;
import com.sparrowlogic.networktopology.model.TgwAttachment;
import com.sparrowlogic.networktopology.model.TgwRouteTable;
import com.sparrowlogic.networktopology.model.TransitGateway;
import com.sparrowlogic.networktopology.model.Vpc;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class MermaidDiagramService {

    private static final String LOCAL_VPC_LINK = "#93c5fd";
    private static final String CROSS_ACCOUNT_LINK = "#fcd34d";
    private static final String VPN_LINK = "#86efac";
    private static final String OTHER_LINK = "#d8b4fe";

    private final int maxRoutesPerTable;

    public MermaidDiagramService(TopologyProperties properties) {
        this.maxRoutesPerTable = Math.max(1, properties.diagram().maxRoutesPerTable());
    }

    public String generateDiagram(NetworkCatalog catalog) {
        var diagram = new StringBuilder("flowchart TB\n\n");

        diagram.append("    classDef tgw fill:#ff9900,stroke:#232f3e,color:#232f3e\n");
        diagram.append("    classDef tgwrt fill:#232f3e,stroke:#232f3e,color:#fff\n");
        diagram.append("    classDef vpc fill:#3b82f6,stroke:#1e40af,color:#fff\n");
        diagram.append("    classDef vpcCrossAcct fill:#e67e22,stroke:#d35400,color:#fff\n");
        diagram.append("    classDef vpn fill:#22c55e,stroke:#166534,color:#fff\n");
        diagram.append("    classDef dx fill:#a855f7,stroke:#7c3aed,color:#fff\n");
        diagram.append("    classDef tgwExternal fill:#ff9900,stroke:#232f3e,color:#232f3e,stroke-dasharray: 5 5\n\n");

        // Mermaid numbers links in order of appearance, so colors are collected as links are drawn
        var linkColors = new ArrayList<String>();

        if (catalog.isSpoke()) {
            addSpokeView(diagram, catalog, linkColors);
        } else {
            catalog.getTransitGateways().values().forEach(tgw -> addGateway(diagram, catalog, tgw, linkColors));
            addVpcAttachments(diagram, catalog, linkColors);
            addOtherAttachments(diagram, catalog, linkColors);
        }

        for (var i = 0; i < linkColors.size(); i++) {
            var color = linkColors.get(i);
            if (color != null) {
                diagram.append("    linkStyle ").append(i).append(" stroke:").append(color).append(",stroke-width:2px\n");
            }
        }
        return diagram.toString();
    }

    private void addSpokeView(StringBuilder diagram, NetworkCatalog catalog, List<String> linkColors) {
        // The owning account is elsewhere, so each referenced gateway becomes a placeholder
        for (var tgwId : catalog.referencedTgwIds()) {
            var tgwNode = safeId(tgwId);
            diagram.append("    subgraph TGW_").append(tgwNode).append("[\"Transit Gateway (External)\"]\n");
            diagram.append("        TGW_NODE_").append(tgwNode).append("((\"").append(tgwId)
                   .append("<br/><small>Route tables not visible<br/>from spoke account</small>\"))\n");
            diagram.append("        class TGW_NODE_").append(tgwNode).append(" tgwExternal\n");
            diagram.append("    end\n\n");
        }

        for (var vpc : catalog.getVpcs().values()) {
            var features = new ArrayList<String>();
            if (vpc.getIgwId() != null) features.add("IGW");
            if (!vpc.getNatGatewayIds().isEmpty()) features.add("NAT");
            if (vpc.getTgwAttachmentId() != null) features.add("TGW");
            var featureText = features.isEmpty() ? "" : "<br/><small>" + String.join(" | ", features) + "</small>";

            diagram.append("    VPC_").append(safeId(vpc.getId())).append("[\"").append(escape(vpc.displayName()))
                   .append("<br/><small>").append(cidrSummary(vpc.getCidrs())).append("</small>")
                   .append(featureText).append("\"]\n");
            diagram.append("    class VPC_").append(safeId(vpc.getId())).append(" vpc\n");
        }

        catalog.getTgwAttachments().values().stream()
            .filter(att -> att.getType() == AttachmentType.VPC && catalog.getVpcs().containsKey(att.getResourceId()))
            .forEach(att -> {
                diagram.append("    VPC_").append(safeId(att.getResourceId()))
                       .append(" --> TGW_NODE_").append(safeId(att.getTgwId())).append("\n");
                linkColors.add(LOCAL_VPC_LINK);
            });
        diagram.append("\n");
    }

    private void addGateway(StringBuilder diagram, NetworkCatalog catalog, TransitGateway tgw, List<String> linkColors) {
        var tgwNode = safeId(tgw.id());
        diagram.append("    subgraph TGW_").append(tgwNode).append("[\"").append(escape(tgw.displayName())).append("\"]\n");
        diagram.append("        TGW_NODE_").append(tgwNode).append("((\"").append(escape(tgw.displayName())).append("\"))\n");
        diagram.append("        class TGW_NODE_").append(tgwNode).append(" tgw\n");

        for (var rt : catalog.routeTablesOfGateway(tgw.id())) {
            var rtNode = "TGWRT_" + safeId(rt.getId());
            diagram.append("        ").append(rtNode).append("[\"").append(routeTableLabel(catalog, rt)).append("\"]\n");
            diagram.append("        class ").append(rtNode).append(" tgwrt\n");
            diagram.append("        TGW_NODE_").append(tgwNode).append(" --- ").append(rtNode).append("\n");
            linkColors.add(null);
        }
        diagram.append("    end\n\n");
    }

    private String routeTableLabel(NetworkCatalog catalog, TgwRouteTable rt) {
        var label = new StringBuilder("<b>").append(escape(rt.displayName()));
        if (rt.isDefaultAssociation()) {
            label.append(" ⭐");
        }
        label.append("</b>");

        var associated = rt.getAssociations().stream()
            .map(catalog.getTgwAttachments()::get)
            .filter(att -> att != null)
            .map(TgwAttachment::displayName)
            .toList();
        if (!associated.isEmpty()) {
            var text = String.join(", ", associated.subList(0, Math.min(3, associated.size())));
            if (associated.size() > 3) {
                text += " +" + (associated.size() - 3);
            }
            label.append("<br/><small>Assoc: ").append(escape(text)).append("</small>");
        }

        var routeLines = new ArrayList<String>();
        var routes = rt.getRoutes();
        for (var route : routes.subList(0, Math.min(maxRoutesPerTable, routes.size()))) {
            var target = "blackhole";
            var resourceType = "";
            var attachment = route.attachmentId() != null ? catalog.getTgwAttachments().get(route.attachmentId()) : null;
            if (attachment != null) {
                target = truncate(attachment.displayName(), 15);
                resourceType = truncate(attachment.getType().value().toUpperCase(), 3);
            }
            routeLines.add((route.isBlackhole() ? "🕳️" : "✓") + " " + truncate(route.destination(), 18)
                + " → " + escape(target) + " [" + resourceType + "] [" + (route.isPropagated() ? "P" : "S") + "]");
        }
        if (routes.size() > maxRoutesPerTable) {
            routeLines.add("... +" + (routes.size() - maxRoutesPerTable) + " more");
        }
        label.append("<br/><small>").append(String.join("<br/>", routeLines)).append("</small>");
        return label.toString();
    }

    private void addVpcAttachments(StringBuilder diagram, NetworkCatalog catalog, List<String> linkColors) {
        catalog.getTgwAttachments().values().stream()
            .filter(att -> att.getType() == AttachmentType.VPC)
            .forEach(att -> {
                var vpcNode = "VPC_" + safeId(att.getResourceId());
                Vpc vpc = catalog.getVpcs().get(att.getResourceId());
                var crossAccount = vpc == null || att.isCrossAccount();
                var name = vpc != null ? vpc.displayName() : att.displayName();
                var cidrs = vpc != null ? vpc.getCidrs() : att.getCidrs();
                var accountInfo = att.isCrossAccount()
                    ? "<br/><small>🔗 Acct: ..." + lastDigits(att.getResourceOwnerId()) + "</small>" : "";

                diagram.append("    ").append(vpcNode).append("[\"").append(escape(name))
                       .append("<br/><small>").append(cidrSummary(cidrs)).append("</small>")
                       .append(accountInfo).append("\"]\n");
                diagram.append("    class ").append(vpcNode).append(crossAccount ? " vpcCrossAcct\n" : " vpc\n");

                if (att.getAssociatedRouteTableId() != null) {
                    diagram.append("    ").append(vpcNode).append(" --> TGWRT_")
                           .append(safeId(att.getAssociatedRouteTableId())).append("\n");
                    linkColors.add(crossAccount ? CROSS_ACCOUNT_LINK : LOCAL_VPC_LINK);
                }
            });
        diagram.append("\n");
    }

    private void addOtherAttachments(StringBuilder diagram, NetworkCatalog catalog, List<String> linkColors) {
        catalog.getTgwAttachments().values().stream()
            .filter(att -> att.getType() != AttachmentType.VPC)
            .forEach(att -> {
                var attNode = "ATT_" + safeId(att.getId());
                var isVpn = att.getType() == AttachmentType.VPN;
                diagram.append("    ").append(attNode).append("[\"").append(escape(att.displayName()))
                       .append("<br/><small>").append(att.getType().value().toUpperCase()).append("</small>\"]\n");
                diagram.append("    class ").append(attNode).append(isVpn ? " vpn\n" : " dx\n");

                if (att.getAssociatedRouteTableId() != null) {
                    diagram.append("    ").append(attNode).append(" --> TGWRT_")
                           .append(safeId(att.getAssociatedRouteTableId())).append("\n");
                    linkColors.add(isVpn ? VPN_LINK : OTHER_LINK);
                }
            });
        diagram.append("\n");
    }

    private static String cidrSummary(List<String> cidrs) {
        if (cidrs.isEmpty()) {
            return "CIDR unknown";
        }
        return String.join(", ", cidrs.subList(0, Math.min(2, cidrs.size())));
    }

    private static String lastDigits(String accountId) {
        return accountId.length() <= 4 ? accountId : accountId.substring(accountId.length() - 4);
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    static String safeId(String id) {
        return id.replace("-", "_").replace(".", "_").replace("/", "_");
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }
}
