package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.AttachmentType;
import com.sparrowlogic.networktopology.model.RouteOrigin;
import com.sparrowlogic.networktopology.model.RouteState;
import com.sparrowlogic.networktopology.model.TgwAttachment;
import com.sparrowlogic.networktopology.model.TgwRoute;
import com.sparrowlogic.networktopology.model.TgwRouteTable;
import com.sparrowlogic.networktopology.model.TransitGateway;
import com.sparrowlogic.networktopology.model.Vpc;

import java.util.List;

/**
 * Small hand-built catalogs for check tests.
 */
final class TestCatalogs {

    static final String ACCOUNT = "111111111111";

    private TestCatalogs() {
    }

    static TgwRouteTable routeTable(NetworkCatalog catalog, String id) {
        var rt = new TgwRouteTable(id, "tgw-1", id, false, false);
        catalog.getTgwRouteTables().put(id, rt);
        return rt;
    }

    static TgwAttachment vpcAttachment(NetworkCatalog catalog, String id, String cidr, TgwRouteTable associatedTo) {
        catalog.getTransitGateways().putIfAbsent("tgw-1", new TransitGateway("tgw-1", "core", ACCOUNT, 64512, "available"));
        var att = new TgwAttachment(id, "tgw-1", AttachmentType.VPC, "vpc-" + id, ACCOUNT, id, "available", false, ACCOUNT);
        att.setCidrs(List.of(cidr));
        if (associatedTo != null) {
            associatedTo.addAssociation(id);
            att.setAssociatedRouteTableId(associatedTo.getId());
        }
        catalog.getTgwAttachments().put(id, att);
        return att;
    }

    static TgwRoute route(String cidr, String attachmentId) {
        return new TgwRoute(cidr, null, attachmentId, null, "vpc", RouteOrigin.PROPAGATED, RouteState.ACTIVE);
    }

    static TgwRoute blackhole(String cidr) {
        return new TgwRoute(cidr, null, null, null, null, RouteOrigin.STATIC, RouteState.BLACKHOLE);
    }

    static Vpc vpc(NetworkCatalog catalog, String id, String... cidrs) {
        var vpc = new Vpc(id, id, List.of(cidrs), ACCOUNT, false);
        catalog.getVpcs().put(id, vpc);
        return vpc;
    }
}
