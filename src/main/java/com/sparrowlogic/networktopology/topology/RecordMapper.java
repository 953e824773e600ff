package com.sparrowlogic.networktopology.topology;

import com.sparrowlogic.networktopology.ingest.Fields;
import com.sparrowlogic.networktopology.model.AttachmentType;
import com.sparrowlogic.networktopology.model.BgpPeer;
import com.sparrowlogic.networktopology.model.CustomerGateway;
import com.sparrowlogic.networktopology.model.DxConnection;
import com.sparrowlogic.networktopology.model.DxGateway;
import com.sparrowlogic.networktopology.model.DxVirtualInterface;
import com.sparrowlogic.networktopology.model.NatGateway;
import com.sparrowlogic.networktopology.model.RouteOrigin;
import com.sparrowlogic.networktopology.model.RouteState;
import com.sparrowlogic.networktopology.model.Subnet;
import com.sparrowlogic.networktopology.model.TgwAttachment;
import com.sparrowlogic.networktopology.model.TgwRoute;
import com.sparrowlogic.networktopology.model.TgwRouteTable;
import com.sparrowlogic.networktopology.model.TransitGateway;
import com.sparrowlogic.networktopology.model.Vpc;
import com.sparrowlogic.networktopology.model.VpcPeering;
import com.sparrowlogic.networktopology.model.VpcRoute;
import com.sparrowlogic.networktopology.model.VpcRouteTable;
import com.sparrowlogic.networktopology.model.VpnConnection;
import com.sparrowlogic.networktopology.model.VpnTunnel;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw AWS CLI records onto entities. Records without their id field map to
 * {@link Optional#empty()}; every other missing field takes its default.
 */
public class RecordMapper {

    private static final String AWS_PREFIX_LIST_PREFIX = "com.amazonaws.";

    private final String localAccountId;

    public RecordMapper(String localAccountId) {
        this.localAccountId = localAccountId != null ? localAccountId : "";
    }

    public Optional<TransitGateway> transitGateway(Map<String, Object> raw) {
        var id = Fields.str(raw, "TransitGatewayId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TransitGateway(
            id,
            Fields.tagName(raw, "Tags"),
            Fields.str(raw, "OwnerId"),
            Fields.lng(Fields.map(raw, "Options"), "AmazonSideAsn", 0),
            Fields.str(raw, "State")
        ));
    }

    public Optional<TgwAttachment> attachment(Map<String, Object> raw) {
        var id = Fields.str(raw, "TransitGatewayAttachmentId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        var resourceOwner = Fields.str(raw, "ResourceOwnerId");
        var tgwOwner = Fields.str(raw, "TransitGatewayOwnerId");
        return Optional.of(new TgwAttachment(
            id,
            Fields.str(raw, "TransitGatewayId"),
            AttachmentType.fromValue(Fields.str(raw, "ResourceType", "unknown")),
            Fields.str(raw, "ResourceId"),
            resourceOwner,
            Fields.tagName(raw, "Tags"),
            Fields.str(raw, "State"),
            isCrossAccount(resourceOwner, tgwOwner),
            tgwOwner
        ));
    }

    /**
     * Compares against the gateway owner when it is known, else against the local account.
     */
    boolean isCrossAccount(String resourceOwner, String tgwOwner) {
        if (resourceOwner.isEmpty()) {
            return false;
        }
        if (!tgwOwner.isEmpty()) {
            return !resourceOwner.equals(tgwOwner);
        }
        if (!localAccountId.isEmpty()) {
            return !resourceOwner.equals(localAccountId);
        }
        return false;
    }

    public Optional<TgwRouteTable> tgwRouteTable(Map<String, Object> raw) {
        var id = Fields.str(raw, "TransitGatewayRouteTableId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TgwRouteTable(
            id,
            Fields.str(raw, "TransitGatewayId"),
            Fields.tagName(raw, "Tags"),
            Fields.bool(raw, "DefaultAssociationRouteTable"),
            Fields.bool(raw, "DefaultPropagationRouteTable")
        ));
    }

    /**
     * Only the first attachment listed on a route is kept.
     */
    public TgwRoute tgwRoute(Map<String, Object> raw) {
        String attachmentId = null;
        String resourceId = null;
        String resourceType = null;
        var attachments = Fields.list(raw, "TransitGatewayAttachments");
        if (!attachments.isEmpty()) {
            var first = attachments.get(0);
            attachmentId = Fields.optStr(first, "TransitGatewayAttachmentId");
            resourceId = Fields.optStr(first, "ResourceId");
            resourceType = Fields.optStr(first, "ResourceType");
        }
        return new TgwRoute(
            Fields.str(raw, "DestinationCidrBlock"),
            Fields.optStr(raw, "PrefixListId"),
            attachmentId,
            resourceId,
            resourceType,
            RouteOrigin.fromValue(Fields.str(raw, "Type")),
            RouteState.fromValue(Fields.str(raw, "State"))
        );
    }

    public Optional<Vpc> vpc(Map<String, Object> raw) {
        var id = Fields.str(raw, "VpcId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        var cidrs = new ArrayList<String>();
        var primary = Fields.str(raw, "CidrBlock");
        if (!primary.isEmpty()) {
            cidrs.add(primary);
        }
        for (var association : Fields.list(raw, "CidrBlockAssociationSet")) {
            var cidr = Fields.str(association, "CidrBlock");
            if (!cidr.isEmpty() && !cidrs.contains(cidr)) {
                cidrs.add(cidr);
            }
        }
        return Optional.of(new Vpc(
            id,
            Fields.tagName(raw, "Tags"),
            cidrs,
            Fields.str(raw, "OwnerId"),
            Fields.bool(raw, "IsDefault")
        ));
    }

    public Optional<Subnet> subnet(Map<String, Object> raw) {
        var id = Fields.str(raw, "SubnetId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Subnet(
            id,
            Fields.str(raw, "VpcId"),
            Fields.str(raw, "CidrBlock"),
            Fields.str(raw, "AvailabilityZone"),
            Fields.tagName(raw, "Tags")
        ));
    }

    public Optional<VpcRouteTable> vpcRouteTable(Map<String, Object> raw) {
        var id = Fields.str(raw, "RouteTableId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        var routes = Fields.list(raw, "Routes").stream().map(this::vpcRoute).toList();
        return Optional.of(new VpcRouteTable(id, Fields.str(raw, "VpcId"), Fields.tagName(raw, "Tags"), routes));
    }

    public VpcRoute vpcRoute(Map<String, Object> raw) {
        var destination = Fields.str(raw, "DestinationCidrBlock");
        if (destination.isEmpty()) {
            destination = Fields.str(raw, "DestinationIpv6CidrBlock");
        }
        if (destination.isEmpty()) {
            destination = Fields.str(raw, "DestinationPrefixListId");
        }
        var target = RouteTargetResolver.resolve(raw);
        return new VpcRoute(destination, target.type(), target.id(), RouteState.fromValue(Fields.str(raw, "State")));
    }

    public Optional<NatGateway> natGateway(Map<String, Object> raw) {
        var id = Fields.str(raw, "NatGatewayId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new NatGateway(
            id,
            Fields.str(raw, "VpcId"),
            Fields.str(raw, "SubnetId"),
            Fields.str(raw, "State"),
            Fields.tagName(raw, "Tags")
        ));
    }

    public Optional<VpcPeering> peering(Map<String, Object> raw) {
        var id = Fields.str(raw, "VpcPeeringConnectionId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        var requester = Fields.map(raw, "RequesterVpcInfo");
        var accepter = Fields.map(raw, "AccepterVpcInfo");
        return Optional.of(new VpcPeering(
            id,
            Fields.tagName(raw, "Tags"),
            Fields.str(Fields.map(raw, "Status"), "Code"),
            Fields.str(requester, "VpcId"),
            Fields.str(requester, "CidrBlock"),
            Fields.str(accepter, "VpcId"),
            Fields.str(accepter, "CidrBlock")
        ));
    }

    public Optional<VpnConnection> vpnConnection(Map<String, Object> raw) {
        var id = Fields.str(raw, "VpnConnectionId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        var tunnels = Fields.list(raw, "VgwTelemetry").stream()
            .map(telemetry -> new VpnTunnel(
                Fields.str(telemetry, "OutsideIpAddress"),
                Fields.str(telemetry, "Status", "DOWN"),
                Fields.str(telemetry, "StatusMessage"),
                Fields.integer(telemetry, "AcceptedRouteCount", 0),
                Fields.str(telemetry, "LastStatusChange")
            )).toList();
        var options = Fields.map(raw, "Options");
        var routes = Fields.list(raw, "Routes").stream()
            .map(route -> Fields.str(route, "DestinationCidrBlock"))
            .toList();
        return Optional.of(new VpnConnection(
            id,
            Fields.tagName(raw, "Tags"),
            Fields.str(raw, "State"),
            Fields.str(raw, "CustomerGatewayId"),
            Fields.optStr(raw, "TransitGatewayId"),
            Fields.optStr(raw, "VpnGatewayId"),
            tunnels,
            Fields.bool(options, "StaticRoutesOnly"),
            Fields.bool(options, "EnableAcceleration"),
            Fields.str(options, "LocalIpv4NetworkCidr", "0.0.0.0/0"),
            Fields.str(options, "RemoteIpv4NetworkCidr", "0.0.0.0/0"),
            routes
        ));
    }

    public Optional<CustomerGateway> customerGateway(Map<String, Object> raw) {
        var id = Fields.str(raw, "CustomerGatewayId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CustomerGateway(
            id,
            Fields.tagName(raw, "Tags"),
            Fields.str(raw, "IpAddress"),
            Fields.str(raw, "BgpAsn"),
            Fields.str(raw, "State"),
            Fields.str(raw, "DeviceName")
        ));
    }

    public Optional<DxConnection> dxConnection(Map<String, Object> raw) {
        var id = Fields.str(raw, "connectionId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        var name = Fields.str(raw, "connectionName");
        var awsDevice = Fields.str(raw, "awsDeviceV2");
        return Optional.of(new DxConnection(
            id,
            name.isEmpty() ? Fields.tagName(raw, "tags") : name,
            Fields.str(raw, "connectionState"),
            Fields.str(raw, "location"),
            Fields.str(raw, "bandwidth"),
            Fields.integer(raw, "vlan", 0),
            Fields.str(raw, "partnerName"),
            Fields.str(raw, "providerName"),
            "yes".equals(Fields.str(raw, "hasLogicalRedundancy", "no")),
            awsDevice.isEmpty() ? Fields.str(raw, "awsDevice") : awsDevice
        ));
    }

    public Optional<DxGateway> dxGateway(Map<String, Object> raw) {
        var id = Fields.str(raw, "directConnectGatewayId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new DxGateway(
            id,
            Fields.str(raw, "directConnectGatewayName"),
            Fields.lng(raw, "amazonSideAsn", 0),
            Fields.str(raw, "ownerAccount"),
            Fields.str(raw, "directConnectGatewayState")
        ));
    }

    public Optional<DxVirtualInterface> dxVirtualInterface(Map<String, Object> raw) {
        var id = Fields.str(raw, "virtualInterfaceId");
        if (id.isEmpty()) {
            return Optional.empty();
        }
        var peers = Fields.list(raw, "bgpPeers").stream()
            .map(peer -> new BgpPeer(
                Fields.str(peer, "bgpPeerId"),
                Fields.lng(peer, "asn", 0),
                Fields.str(peer, "amazonAddress"),
                Fields.str(peer, "customerAddress"),
                Fields.str(peer, "bgpPeerState"),
                Fields.str(peer, "bgpStatus", "down")
            )).toList();
        var prefixes = Fields.list(raw, "routeFilterPrefixes").stream()
            .map(prefix -> Fields.str(prefix, "cidr"))
            .toList();
        var name = Fields.str(raw, "virtualInterfaceName");
        return Optional.of(new DxVirtualInterface(
            id,
            name.isEmpty() ? Fields.tagName(raw, "tags") : name,
            Fields.str(raw, "virtualInterfaceType"),
            Fields.str(raw, "virtualInterfaceState"),
            Fields.str(raw, "connectionId"),
            Fields.integer(raw, "vlan", 0),
            Fields.lng(raw, "asn", 0),
            Fields.lng(raw, "amazonSideAsn", 0),
            Fields.str(raw, "amazonAddress"),
            Fields.str(raw, "customerAddress"),
            Fields.integer(raw, "mtu", 1500),
            Fields.bool(raw, "jumboFrameCapable"),
            peers,
            Fields.optStr(raw, "directConnectGatewayId"),
            Fields.optStr(raw, "virtualGatewayId"),
            prefixes
        ));
    }

    /**
     * AWS managed prefix lists ({@code com.amazonaws.<region>.<service>}) are shortened to the
     * service name.
     */
    public static String prefixListName(String rawName) {
        if (rawName.startsWith(AWS_PREFIX_LIST_PREFIX)) {
            var parts = rawName.split("\\.");
            if (parts.length >= 4) {
                return parts[parts.length - 1];
            }
        }
        return rawName;
    }
}
