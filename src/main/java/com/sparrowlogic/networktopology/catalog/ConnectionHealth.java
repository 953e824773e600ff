package com.sparrowlogic.networktopology.catalog;

import com.sparrowlogic.networktopology.model.BgpPeer;
import com.sparrowlogic.networktopology.model.DxVirtualInterface;
import com.sparrowlogic.networktopology.model.VpnConnection;
import com.sparrowlogic.networktopology.model.VpnTunnel;

/**
 * Read-only health projections over VPN connections and Direct Connect interfaces.
 */
public final class ConnectionHealth {

    public enum TunnelStatus { ALL_UP, PARTIAL, DOWN }

    public enum BgpStatus { NO_PEERS, ALL_UP, PARTIAL, DOWN }

    private ConnectionHealth() {
    }

    public static long tunnelsUp(VpnConnection vpn) {
        return vpn.tunnels().stream().filter(VpnTunnel::isUp).count();
    }

    /**
     * A connection without tunnels counts as all up, since nothing is reported down.
     */
    public static TunnelStatus tunnelStatus(VpnConnection vpn) {
        var up = tunnelsUp(vpn);
        if (up == vpn.tunnels().size()) {
            return TunnelStatus.ALL_UP;
        }
        return up > 0 ? TunnelStatus.PARTIAL : TunnelStatus.DOWN;
    }

    public static String tunnelSummary(VpnConnection vpn) {
        return tunnelsUp(vpn) + "/" + vpn.tunnels().size() + " tunnels UP";
    }

    public static long bgpPeersUp(DxVirtualInterface vif) {
        return vif.bgpPeers().stream().filter(BgpPeer::isUp).count();
    }

    public static BgpStatus bgpStatus(DxVirtualInterface vif) {
        if (vif.bgpPeers().isEmpty()) {
            return BgpStatus.NO_PEERS;
        }
        var up = bgpPeersUp(vif);
        if (up == vif.bgpPeers().size()) {
            return BgpStatus.ALL_UP;
        }
        return up > 0 ? BgpStatus.PARTIAL : BgpStatus.DOWN;
    }

    public static String bgpSummary(DxVirtualInterface vif) {
        return bgpPeersUp(vif) + "/" + vif.bgpPeers().size() + " BGP UP";
    }
}
