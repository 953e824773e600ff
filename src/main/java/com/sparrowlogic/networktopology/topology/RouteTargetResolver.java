package com.sparrowlogic.networktopology.topology;

import com.sparrowlogic.networktopology.ingest.Fields;
import com.sparrowlogic.networktopology.model.RouteTargetType;

import java.util.Map;

/**
 * Resolves the target of a raw VPC route. Fields are consulted in a fixed priority order and the
 * first one that resolves wins.
 */
public final class RouteTargetResolver {

    public record Target(RouteTargetType type, String id) {}

    private static final Target UNKNOWN = new Target(RouteTargetType.UNKNOWN, "");

    private RouteTargetResolver() {
    }

    public static Target resolve(Map<String, Object> route) {
        var gatewayId = Fields.str(route, "GatewayId");
        if (!gatewayId.isEmpty()) {
            var byGateway = fromGatewayId(gatewayId);
            if (byGateway != null) {
                return byGateway;
            }
        }

        var natGatewayId = Fields.str(route, "NatGatewayId");
        if (!natGatewayId.isEmpty()) {
            return new Target(RouteTargetType.NAT, natGatewayId);
        }
        var transitGatewayId = Fields.str(route, "TransitGatewayId");
        if (!transitGatewayId.isEmpty()) {
            return new Target(RouteTargetType.TGW, transitGatewayId);
        }
        var peeringId = Fields.str(route, "VpcPeeringConnectionId");
        if (!peeringId.isEmpty()) {
            return new Target(RouteTargetType.VPC_PEERING, peeringId);
        }
        var interfaceId = Fields.str(route, "NetworkInterfaceId");
        if (!interfaceId.isEmpty()) {
            return new Target(RouteTargetType.ENI, interfaceId);
        }
        return UNKNOWN;
    }

    // An unrecognised gateway prefix falls through to the remaining fields.
    private static Target fromGatewayId(String gatewayId) {
        if ("local".equals(gatewayId)) {
            return new Target(RouteTargetType.LOCAL, "local");
        }
        if (gatewayId.startsWith("igw-")) {
            return new Target(RouteTargetType.IGW, gatewayId);
        }
        if (gatewayId.startsWith("vgw-")) {
            return new Target(RouteTargetType.VGW, gatewayId);
        }
        if (gatewayId.startsWith("eigw-")) {
            return new Target(RouteTargetType.EGRESS_IGW, gatewayId);
        }
        if (gatewayId.startsWith("vpce-")) {
            return new Target(RouteTargetType.VPC_ENDPOINT, gatewayId);
        }
        return null;
    }
}
