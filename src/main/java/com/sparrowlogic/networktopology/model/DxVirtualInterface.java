package com.sparrowlogic.networktopology.model;

import java.util.List;

public record DxVirtualInterface(
    String id,
    String name,
    String vifType,
    String state,
    String connectionId,
    int vlan,
    long customerAsn,
    long amazonAsn,
    String amazonAddress,
    String customerAddress,
    int mtu,
    boolean jumboCapable,
    List<BgpPeer> bgpPeers,
    String dxGatewayId,
    String virtualGatewayId,
    List<String> routeFilterPrefixes
) {
    public DxVirtualInterface {
        bgpPeers = List.copyOf(bgpPeers);
        routeFilterPrefixes = List.copyOf(routeFilterPrefixes);
    }

    public String displayName() {
        return name.isBlank() ? id : name;
    }
}
