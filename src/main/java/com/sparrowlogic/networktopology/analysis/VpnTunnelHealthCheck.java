package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.Severity;

import java.util.ArrayList;
import java.util.List;

/**
 * One error when every tunnel of a connection is down, otherwise one warning per down tunnel.
 */
public class VpnTunnelHealthCheck implements TopologyCheck {

    @Override
    public String name() {
        return "vpn-tunnels";
    }

    @Override
    public List<Finding> run(NetworkCatalog catalog) {
        var findings = new ArrayList<Finding>();
        for (var vpn : catalog.getVpnConnections().values()) {
            var tunnelsDown = vpn.tunnels().stream().filter(t -> !t.isUp()).toList();
            if (!vpn.tunnels().isEmpty() && tunnelsDown.size() == vpn.tunnels().size()) {
                findings.add(new Finding(FindingKind.VPN_DOWN, Severity.ERROR, vpn.displayName(),
                    "All tunnels DOWN for VPN " + vpn.displayName()));
                continue;
            }
            for (var tunnel : tunnelsDown) {
                var message = tunnel.statusMessage().isEmpty() ? "No message" : tunnel.statusMessage();
                findings.add(new Finding(FindingKind.VPN_PARTIAL, Severity.WARNING, vpn.displayName(),
                    "Tunnel " + tunnel.outsideIp() + " DOWN for " + vpn.displayName() + ": " + message));
            }
        }
        return findings;
    }
}
