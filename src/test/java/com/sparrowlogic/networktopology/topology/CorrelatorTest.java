package com.sparrowlogic.networktopology.topology;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.ingest.RawSnapshot;
import com.sparrowlogic.networktopology.ingest.ResourceKind;
import com.sparrowlogic.networktopology.ingest.TableDetail;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.sparrowlogic.networktopology.topology.Records.rec;
import static org.junit.jupiter.api.Assertions.*;

class CorrelatorTest {

    private static final String HUB_ACCOUNT = "111111111111";

    private static Map<String, Object> attachment(String id, String type, String resourceId, String owner) {
        return rec("TransitGatewayAttachmentId", id, "TransitGatewayId", "tgw-1", "TransitGatewayOwnerId", HUB_ACCOUNT,
            "ResourceType", type, "ResourceId", resourceId, "ResourceOwnerId", owner, "State", "available");
    }

    private static Map<String, Object> routeTable(String id) {
        return rec("TransitGatewayRouteTableId", id, "TransitGatewayId", "tgw-1");
    }

    private static Map<String, Object> membership(String attachmentId, String state) {
        return rec("TransitGatewayAttachmentId", attachmentId, "State", state);
    }

    private static Map<String, Object> propagatedRoute(String cidr, String attachmentId) {
        return rec("DestinationCidrBlock", cidr, "Type", "propagated", "State", "active",
            "TransitGatewayAttachments", List.of(rec("TransitGatewayAttachmentId", attachmentId)));
    }

    private static NetworkCatalog correlate(RawSnapshot snapshot) {
        var catalog = new NetworkCatalog(snapshot.accountId());
        new Correlator(catalog).correlate(snapshot);
        return catalog;
    }

    @Test
    void shouldLinkAssociationsOnBothSides() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.TGW_ATTACHMENTS, List.of(attachment("a", "vpc", "vpc-a", HUB_ACCOUNT)))
            .add(ResourceKind.TGW_ROUTE_TABLES, List.of(routeTable("rt-1")))
            .addTableDetail(TableDetail.ASSOCIATIONS, "rt-1", List.of(membership("a", "associated")))
            .addTableDetail(TableDetail.PROPAGATIONS, "rt-1", List.of(membership("a", "enabled")));

        var catalog = correlate(snapshot);

        var rt = catalog.getTgwRouteTables().get("rt-1");
        var att = catalog.getTgwAttachments().get("a");
        assertEquals(Set.of("a"), rt.getAssociations());
        assertEquals("rt-1", att.getAssociatedRouteTableId());
        assertEquals(Set.of("a"), rt.getPropagations());
        assertEquals(List.of("rt-1"), att.getPropagatingTo());
    }

    @Test
    void shouldIgnoreUnsettledMembership() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.TGW_ATTACHMENTS, List.of(attachment("a", "vpc", "vpc-a", HUB_ACCOUNT)))
            .add(ResourceKind.TGW_ROUTE_TABLES, List.of(routeTable("rt-1")))
            .addTableDetail(TableDetail.ASSOCIATIONS, "rt-1", List.of(membership("a", "associating")))
            .addTableDetail(TableDetail.PROPAGATIONS, "rt-1", List.of(membership("a", "disabled")));

        var catalog = correlate(snapshot);

        assertTrue(catalog.getTgwRouteTables().get("rt-1").getAssociations().isEmpty());
        assertNull(catalog.getTgwAttachments().get("a").getAssociatedRouteTableId());
        assertTrue(catalog.getTgwAttachments().get("a").getPropagatingTo().isEmpty());
    }

    @Test
    void shouldIgnoreDetailsOfUnknownRouteTables() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.TGW_ATTACHMENTS, List.of(attachment("a", "vpc", "vpc-a", HUB_ACCOUNT)))
            .addTableDetail(TableDetail.ASSOCIATIONS, "rt-gone", List.of(membership("a", "associated")))
            .addTableDetail(TableDetail.ROUTES, "rt-gone", List.of(propagatedRoute("10.0.0.0/16", "a")));

        var catalog = correlate(snapshot);

        assertNull(catalog.getTgwAttachments().get("a").getAssociatedRouteTableId());
        assertTrue(catalog.getTgwRouteTables().isEmpty());
    }

    @Test
    void shouldCopyLocalVpcDetailsOntoAttachment() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.TGW_ATTACHMENTS, List.of(attachment("a", "vpc", "vpc-a", HUB_ACCOUNT)))
            .add(ResourceKind.VPCS, List.of(rec("VpcId", "vpc-a", "CidrBlock", "10.0.0.0/16",
                "Tags", List.of(rec("Key", "Name", "Value", "app")))));

        var catalog = correlate(snapshot);

        var att = catalog.getTgwAttachments().get("a");
        assertEquals(List.of("10.0.0.0/16"), att.getCidrs());
        assertEquals("app", att.displayName());
        assertEquals("a", catalog.getVpcs().get("vpc-a").getTgwAttachmentId());
    }

    @Test
    void shouldRecoverCidrsFromPropagatedRoutesSorted() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.TGW_ATTACHMENTS, List.of(attachment("remote", "vpc", "vpc-remote", "222222222222")))
            .add(ResourceKind.TGW_ROUTE_TABLES, List.of(routeTable("rt-1"), routeTable("rt-2")))
            .addTableDetail(TableDetail.ROUTES, "rt-1", List.of(
                propagatedRoute("172.17.0.0/16", "remote"),
                propagatedRoute("172.16.0.0/16", "remote")))
            .addTableDetail(TableDetail.ROUTES, "rt-2", List.of(
                propagatedRoute("172.16.0.0/16", "remote"),
                rec("DestinationCidrBlock", "172.18.0.0/16", "Type", "static", "State", "active",
                    "TransitGatewayAttachments", List.of(rec("TransitGatewayAttachmentId", "remote")))));

        var catalog = correlate(snapshot);

        var att = catalog.getTgwAttachments().get("remote");
        assertTrue(att.isCrossAccount());
        assertEquals(List.of("172.16.0.0/16", "172.17.0.0/16"), att.getCidrs());
    }

    @Test
    void shouldNotOverwriteKnownCidrs() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.TGW_ATTACHMENTS, List.of(attachment("a", "vpc", "vpc-a", HUB_ACCOUNT)))
            .add(ResourceKind.VPCS, List.of(rec("VpcId", "vpc-a", "CidrBlock", "10.0.0.0/16")))
            .add(ResourceKind.TGW_ROUTE_TABLES, List.of(routeTable("rt-1")))
            .addTableDetail(TableDetail.ROUTES, "rt-1", List.of(propagatedRoute("10.9.0.0/16", "a")));

        var catalog = correlate(snapshot);

        assertEquals(List.of("10.0.0.0/16"), catalog.getTgwAttachments().get("a").getCidrs());
    }

    @Test
    void shouldOnlyRecoverCidrsForVpcAndVpnAttachments() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.TGW_ATTACHMENTS, List.of(
                attachment("vpn", "vpn", "vpn-1", HUB_ACCOUNT),
                attachment("dx", "direct-connect-gateway", "dxgw-1", HUB_ACCOUNT)))
            .add(ResourceKind.TGW_ROUTE_TABLES, List.of(routeTable("rt-1")))
            .addTableDetail(TableDetail.ROUTES, "rt-1", List.of(
                propagatedRoute("192.168.0.0/16", "vpn"),
                propagatedRoute("10.200.0.0/16", "dx")));

        var catalog = correlate(snapshot);

        assertEquals(List.of("192.168.0.0/16"), catalog.getTgwAttachments().get("vpn").getCidrs());
        assertTrue(catalog.getTgwAttachments().get("dx").getCidrs().isEmpty());
    }

    @Test
    void shouldLinkVpcRouteTablesAndGateways() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.VPCS, List.of(rec("VpcId", "vpc-a", "CidrBlock", "10.0.0.0/16")))
            .add(ResourceKind.SUBNETS, List.of(rec("SubnetId", "subnet-1", "VpcId", "vpc-a")))
            .add(ResourceKind.VPC_ROUTE_TABLES, List.of(rec("RouteTableId", "rtb-1", "VpcId", "vpc-a",
                "Associations", List.of(rec("Main", true), rec("Main", false, "SubnetId", "subnet-1")))))
            .add(ResourceKind.INTERNET_GATEWAYS, List.of(
                rec("InternetGatewayId", "igw-1", "Attachments", List.of(rec("VpcId", "vpc-a", "State", "available"))),
                rec("InternetGatewayId", "igw-2", "Attachments", List.of(rec("VpcId", "vpc-a", "State", "detaching")))))
            .add(ResourceKind.NAT_GATEWAYS, List.of(rec("NatGatewayId", "nat-1", "VpcId", "vpc-a")));

        var catalog = correlate(snapshot);

        var vpc = catalog.getVpcs().get("vpc-a");
        var rt = catalog.getVpcRouteTables().get("rtb-1");
        assertTrue(rt.isMain());
        assertEquals("rtb-1", vpc.getMainRouteTableId());
        assertEquals(List.of("subnet-1"), rt.getSubnetIds());
        assertEquals("rtb-1", catalog.getSubnets().get("subnet-1").getRouteTableId());
        assertEquals("igw-1", vpc.getIgwId());
        assertEquals(Map.of("igw-1", "vpc-a"), catalog.getInternetGateways());
        assertEquals(List.of("nat-1"), vpc.getNatGatewayIds());
    }

    @Test
    void shouldShortenPrefixListNames() {
        var snapshot = new RawSnapshot(HUB_ACCOUNT)
            .add(ResourceKind.PREFIX_LISTS, List.of(rec("PrefixListId", "pl-1", "PrefixListName", "com.amazonaws.eu-west-1.dynamodb")));

        var catalog = correlate(snapshot);

        assertEquals("dynamodb", catalog.prefixListName("pl-1"));
    }
}
