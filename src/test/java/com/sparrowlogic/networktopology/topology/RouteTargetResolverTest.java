package com.sparrowlogic.networktopology.topology;

import com.sparrowlogic.networktopology.model.RouteTargetType;
import org.junit.jupiter.api.Test;

import static com.sparrowlogic.networktopology.topology.Records.rec;
import static org.junit.jupiter.api.Assertions.*;

class RouteTargetResolverTest {

    @Test
    void shouldResolveGatewayIdPrefixes() {
        assertEquals(RouteTargetType.LOCAL, RouteTargetResolver.resolve(rec("GatewayId", "local")).type());
        assertEquals(RouteTargetType.IGW, RouteTargetResolver.resolve(rec("GatewayId", "igw-1")).type());
        assertEquals(RouteTargetType.VGW, RouteTargetResolver.resolve(rec("GatewayId", "vgw-1")).type());
        assertEquals(RouteTargetType.EGRESS_IGW, RouteTargetResolver.resolve(rec("GatewayId", "eigw-1")).type());
        assertEquals(RouteTargetType.VPC_ENDPOINT, RouteTargetResolver.resolve(rec("GatewayId", "vpce-1")).type());
    }

    @Test
    void shouldResolveOtherTargetFields() {
        var nat = RouteTargetResolver.resolve(rec("NatGatewayId", "nat-1"));
        assertEquals(RouteTargetType.NAT, nat.type());
        assertEquals("nat-1", nat.id());

        assertEquals(RouteTargetType.TGW, RouteTargetResolver.resolve(rec("TransitGatewayId", "tgw-1")).type());
        assertEquals(RouteTargetType.VPC_PEERING,
            RouteTargetResolver.resolve(rec("VpcPeeringConnectionId", "pcx-1")).type());
        assertEquals(RouteTargetType.ENI, RouteTargetResolver.resolve(rec("NetworkInterfaceId", "eni-1")).type());
    }

    @Test
    void shouldPreferGatewayIdOverLaterFields() {
        var target = RouteTargetResolver.resolve(rec("GatewayId", "igw-1", "NatGatewayId", "nat-1"));

        assertEquals(RouteTargetType.IGW, target.type());
    }

    @Test
    void shouldFallThroughUnrecognisedGatewayPrefix() {
        var target = RouteTargetResolver.resolve(rec("GatewayId", "cagw-1", "TransitGatewayId", "tgw-1"));

        assertEquals(RouteTargetType.TGW, target.type());
        assertEquals("tgw-1", target.id());
    }

    @Test
    void shouldReturnUnknownWithoutTarget() {
        var target = RouteTargetResolver.resolve(rec("DestinationCidrBlock", "10.0.0.0/8"));

        assertEquals(RouteTargetType.UNKNOWN, target.type());
        assertEquals("", target.id());
    }
}
