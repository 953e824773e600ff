package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.Severity;
import com.sparrowlogic.networktopology.model.TgwAttachment;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags attachment pairs on the same gateway where traffic can flow one way but not back.
 *
 * <p>Only gateways described in the snapshot are examined; attachments into a gateway owned by
 * another account are skipped because its route tables are not visible. Reachability is single-hop: only the source's associated route table is consulted, and only
 * routes attributed to the destination attachment count.
 */
public class AsymmetricReachabilityCheck implements TopologyCheck {

    private static final String DEFAULT_ROUTE = "0.0.0.0/0";

    @Override
    public String name() {
        return "asymmetric-routing";
    }

    @Override
    public List<Finding> run(NetworkCatalog catalog) {
        var findings = new ArrayList<Finding>();
        catalog.attachmentsByGateway().forEach((tgwId, attachments) -> {
            if (!catalog.getTransitGateways().containsKey(tgwId)) {
                return;
            }
            for (var src : attachments) {
                for (var dst : attachments) {
                    if (src.getId().equals(dst.getId())) {
                        continue;
                    }
                    if (canReach(catalog, src, dst) && !canReach(catalog, dst, src)) {
                        findings.add(new Finding(FindingKind.ASYMMETRIC, Severity.WARNING,
                            src.displayName() + " → " + dst.displayName(),
                            "Asymmetric routing: " + src.displayName() + " can reach " + dst.displayName()
                                + " but not vice versa"));
                    }
                }
            }
        });
        return findings;
    }

    static boolean canReach(NetworkCatalog catalog, TgwAttachment src, TgwAttachment dst) {
        var routeTableId = src.getAssociatedRouteTableId();
        if (routeTableId == null) {
            return false;
        }
        var rt = catalog.getTgwRouteTables().get(routeTableId);
        if (rt == null) {
            return false;
        }
        for (var cidr : dst.getCidrs()) {
            for (var route : rt.getRoutes()) {
                if (route.isBlackhole() || !dst.getId().equals(route.attachmentId())) {
                    continue;
                }
                if (cidrMatches(route.destinationCidr(), cidr)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * True when the target network lies within the route destination. The IPv4 default route
     * matches anything; strings that do not parse, or mix address families, are compared verbatim.
     */
    static boolean cidrMatches(String routeCidr, String targetCidr) {
        if (DEFAULT_ROUTE.equals(routeCidr)) {
            return true;
        }
        var route = Cidr.parse(routeCidr);
        var target = Cidr.parse(targetCidr);
        if (route.isEmpty() || target.isEmpty() || !route.get().sameFamily(target.get())) {
            return routeCidr != null && routeCidr.equals(targetCidr);
        }
        return route.get().contains(target.get());
    }
}
