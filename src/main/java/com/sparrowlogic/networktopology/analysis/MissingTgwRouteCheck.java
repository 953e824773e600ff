package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.RouteTargetType;
import com.sparrowlogic.networktopology.model.Severity;

import java.util.List;

/**
 * VPCs plugged into a Transit Gateway that none of their route tables send traffic to.
 */
public class MissingTgwRouteCheck implements TopologyCheck {

    @Override
    public String name() {
        return "missing-tgw-routes";
    }

    @Override
    public List<Finding> run(NetworkCatalog catalog) {
        return catalog.getVpcs().values().stream()
            .filter(vpc -> vpc.getTgwAttachmentId() != null)
            .filter(vpc -> catalog.routeTablesOfVpc(vpc.getId()).stream()
                .flatMap(rt -> rt.getRoutes().stream())
                .noneMatch(route -> route.targetType() == RouteTargetType.TGW))
            .map(vpc -> new Finding(FindingKind.MISSING_ROUTE, Severity.INFO, vpc.displayName(),
                "VPC " + vpc.displayName() + " is attached to TGW but has no TGW routes in any route table"))
            .toList();
    }
}
