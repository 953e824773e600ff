package com.sparrowlogic.networktopology.model;

import java.util.List;

/**
 * A Site-to-Site VPN connection with its tunnel telemetry.
 *
 * @param routes static or propagated CIDRs reported on the connection
 */
public record VpnConnection(
    String id,
    String name,
    String state,
    String customerGatewayId,
    String tgwId,
    String vpnGatewayId,
    List<VpnTunnel> tunnels,
    boolean staticRoutesOnly,
    boolean accelerationEnabled,
    String localCidr,
    String remoteCidr,
    List<String> routes
) {
    public VpnConnection {
        tunnels = List.copyOf(tunnels);
        routes = List.copyOf(routes);
    }

    public String displayName() {
        return name.isBlank() ? id : name;
    }
}
