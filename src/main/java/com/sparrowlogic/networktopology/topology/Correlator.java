package com.sparrowlogic.networktopology.topology;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.ingest.Fields;
import com.sparrowlogic.networktopology.ingest.RawSnapshot;
import com.sparrowlogic.networktopology.ingest.ResourceKind;
import com.sparrowlogic.networktopology.ingest.TableDetail;
import com.sparrowlogic.networktopology.model.AttachmentType;
import com.sparrowlogic.networktopology.model.TgwAttachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Populates a {@link NetworkCatalog} from raw record batches and links the independently loaded
 * entities to each other.
 *
 * <p>Every cross-collection lookup is a soft miss: when a referenced id is not in the catalog the
 * link is skipped. Links are established once, here; nothing downstream re-derives them.
 */
public class Correlator {

    private static final Logger log = LoggerFactory.getLogger(Correlator.class);

    private final NetworkCatalog catalog;
    private final RecordMapper mapper;

    public Correlator(NetworkCatalog catalog) {
        this.catalog = catalog;
        this.mapper = new RecordMapper(catalog.getLocalAccountId());
    }

    public NetworkCatalog correlate(RawSnapshot snapshot) {
        populate(snapshot);
        linkRouteTableMembership(snapshot);
        linkVpcRouteTables(snapshot);
        linkGateways(snapshot);
        linkAttachmentsToVpcs();
        recoverCrossAccountCidrs();
        log.info("Correlated {} attachment(s) ({} cross-account) across {} TGW route table(s)",
            catalog.getTgwAttachments().size(), catalog.crossAccountAttachments().size(),
            catalog.getTgwRouteTables().size());
        return catalog;
    }

    void populate(RawSnapshot snapshot) {
        load(snapshot, ResourceKind.TRANSIT_GATEWAYS, mapper::transitGateway,
            tgw -> catalog.getTransitGateways().put(tgw.id(), tgw));
        load(snapshot, ResourceKind.TGW_ATTACHMENTS, mapper::attachment,
            att -> catalog.getTgwAttachments().put(att.getId(), att));
        load(snapshot, ResourceKind.TGW_ROUTE_TABLES, mapper::tgwRouteTable,
            rt -> catalog.getTgwRouteTables().put(rt.getId(), rt));
        load(snapshot, ResourceKind.VPCS, mapper::vpc,
            vpc -> catalog.getVpcs().put(vpc.getId(), vpc));
        load(snapshot, ResourceKind.SUBNETS, mapper::subnet,
            subnet -> catalog.getSubnets().put(subnet.getId(), subnet));
        load(snapshot, ResourceKind.VPC_ROUTE_TABLES, mapper::vpcRouteTable,
            rt -> catalog.getVpcRouteTables().put(rt.getId(), rt));
        load(snapshot, ResourceKind.NAT_GATEWAYS, mapper::natGateway,
            nat -> catalog.getNatGateways().put(nat.id(), nat));
        load(snapshot, ResourceKind.VPC_PEERINGS, mapper::peering,
            pcx -> catalog.getPeerings().put(pcx.id(), pcx));
        load(snapshot, ResourceKind.VPN_CONNECTIONS, mapper::vpnConnection,
            vpn -> catalog.getVpnConnections().put(vpn.id(), vpn));
        load(snapshot, ResourceKind.CUSTOMER_GATEWAYS, mapper::customerGateway,
            cgw -> catalog.getCustomerGateways().put(cgw.id(), cgw));
        load(snapshot, ResourceKind.DX_CONNECTIONS, mapper::dxConnection,
            conn -> catalog.getDxConnections().put(conn.id(), conn));
        load(snapshot, ResourceKind.DX_GATEWAYS, mapper::dxGateway,
            gw -> catalog.getDxGateways().put(gw.id(), gw));
        load(snapshot, ResourceKind.DX_VIRTUAL_INTERFACES, mapper::dxVirtualInterface,
            vif -> catalog.getDxVirtualInterfaces().put(vif.id(), vif));

        for (var raw : snapshot.batch(ResourceKind.PREFIX_LISTS)) {
            var id = Fields.str(raw, "PrefixListId");
            if (!id.isEmpty()) {
                catalog.getPrefixLists().put(id, RecordMapper.prefixListName(Fields.str(raw, "PrefixListName")));
            }
        }

        // Routes only belong to tables the snapshot actually describes.
        snapshot.tableDetails(TableDetail.ROUTES).forEach((routeTableId, routes) -> {
            var rt = catalog.getTgwRouteTables().get(routeTableId);
            if (rt == null) {
                log.debug("Ignoring {} route(s) for unknown TGW route table {}", routes.size(), routeTableId);
                return;
            }
            routes.forEach(raw -> rt.addRoute(mapper.tgwRoute(raw)));
        });
    }

    private <T> void load(RawSnapshot snapshot, ResourceKind kind,
                          Function<Map<String, Object>, Optional<T>> mapping,
                          Consumer<T> store) {
        var skipped = 0;
        for (var raw : snapshot.batch(kind)) {
            var entity = mapping.apply(raw);
            if (entity.isPresent()) {
                store.accept(entity.get());
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} {} record(s) without an id", skipped, kind);
        }
    }

    /**
     * Records settled associations and propagations on both the route table and the attachment.
     * Associations in any state other than {@code associated} (propagations: {@code enabled}) are
     * ignored.
     */
    void linkRouteTableMembership(RawSnapshot snapshot) {
        snapshot.tableDetails(TableDetail.ASSOCIATIONS).forEach((routeTableId, associations) -> {
            var rt = catalog.getTgwRouteTables().get(routeTableId);
            if (rt == null) {
                return;
            }
            for (var association : associations) {
                var attachmentId = Fields.str(association, "TransitGatewayAttachmentId");
                if (!"associated".equals(Fields.str(association, "State")) || attachmentId.isEmpty()) {
                    continue;
                }
                rt.addAssociation(attachmentId);
                var attachment = catalog.getTgwAttachments().get(attachmentId);
                if (attachment != null) {
                    attachment.setAssociatedRouteTableId(routeTableId);
                }
            }
        });

        snapshot.tableDetails(TableDetail.PROPAGATIONS).forEach((routeTableId, propagations) -> {
            var rt = catalog.getTgwRouteTables().get(routeTableId);
            if (rt == null) {
                return;
            }
            for (var propagation : propagations) {
                var attachmentId = Fields.str(propagation, "TransitGatewayAttachmentId");
                if (!"enabled".equals(Fields.str(propagation, "State")) || attachmentId.isEmpty()) {
                    continue;
                }
                rt.addPropagation(attachmentId);
                var attachment = catalog.getTgwAttachments().get(attachmentId);
                if (attachment != null) {
                    attachment.addPropagatingTo(routeTableId);
                }
            }
        });
    }

    void linkVpcRouteTables(RawSnapshot snapshot) {
        for (var raw : snapshot.batch(ResourceKind.VPC_ROUTE_TABLES)) {
            var rt = catalog.getVpcRouteTables().get(Fields.str(raw, "RouteTableId"));
            if (rt == null) {
                continue;
            }
            for (var association : Fields.list(raw, "Associations")) {
                if (Fields.bool(association, "Main")) {
                    rt.markMain();
                    var vpc = catalog.getVpcs().get(rt.getVpcId());
                    if (vpc != null) {
                        vpc.setMainRouteTableId(rt.getId());
                    }
                }
                var subnetId = Fields.str(association, "SubnetId");
                if (!subnetId.isEmpty()) {
                    rt.addSubnetId(subnetId);
                    var subnet = catalog.getSubnets().get(subnetId);
                    if (subnet != null) {
                        subnet.setRouteTableId(rt.getId());
                    }
                }
            }
        }
    }

    void linkGateways(RawSnapshot snapshot) {
        for (var raw : snapshot.batch(ResourceKind.INTERNET_GATEWAYS)) {
            var igwId = Fields.str(raw, "InternetGatewayId");
            if (igwId.isEmpty()) {
                continue;
            }
            for (var attachment : Fields.list(raw, "Attachments")) {
                if (!"available".equals(Fields.str(attachment, "State"))) {
                    continue;
                }
                var vpcId = Fields.str(attachment, "VpcId");
                catalog.getInternetGateways().put(igwId, vpcId);
                var vpc = catalog.getVpcs().get(vpcId);
                if (vpc != null) {
                    vpc.setIgwId(igwId);
                }
            }
        }

        catalog.getNatGateways().values().forEach(nat -> {
            var vpc = catalog.getVpcs().get(nat.vpcId());
            if (vpc != null) {
                vpc.addNatGatewayId(nat.id());
            }
        });
    }

    /**
     * Copies CIDRs and name of locally described VPCs onto their attachments. Cross-account VPC
     * attachments stay CIDR-less here.
     */
    void linkAttachmentsToVpcs() {
        for (var attachment : catalog.getTgwAttachments().values()) {
            if (attachment.getType() != AttachmentType.VPC) {
                continue;
            }
            var vpc = catalog.getVpcs().get(attachment.getResourceId());
            if (vpc == null) {
                continue;
            }
            attachment.setCidrs(vpc.getCidrs());
            attachment.setName(vpc.getName());
            vpc.setTgwAttachmentId(attachment.getId());
        }
    }

    /**
     * Fills in CIDRs of VPC and VPN attachments the local account cannot describe, using the
     * destinations they propagated into shared route tables. Attachments that already have CIDRs
     * are left alone.
     */
    void recoverCrossAccountCidrs() {
        var candidates = new HashMap<String, Set<String>>();
        for (var rt : catalog.getTgwRouteTables().values()) {
            for (var route : rt.getRoutes()) {
                if (!route.isPropagated() || route.attachmentId() == null) {
                    continue;
                }
                if (route.prefixListId() != null || route.destinationCidr().isEmpty()) {
                    continue;
                }
                candidates.computeIfAbsent(route.attachmentId(), k -> new TreeSet<>()).add(route.destinationCidr());
            }
        }

        var recovered = 0;
        for (var attachment : catalog.getTgwAttachments().values()) {
            if (!acceptsRecoveredCidrs(attachment)) {
                continue;
            }
            var cidrs = candidates.get(attachment.getId());
            if (cidrs != null) {
                attachment.setCidrs(new ArrayList<>(cidrs));
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("Recovered CIDRs for {} attachment(s) from propagated routes", recovered);
        }
    }

    private static boolean acceptsRecoveredCidrs(TgwAttachment attachment) {
        var type = attachment.getType();
        return (type == AttachmentType.VPC || type == AttachmentType.VPN) && attachment.getCidrs().isEmpty();
    }
}
