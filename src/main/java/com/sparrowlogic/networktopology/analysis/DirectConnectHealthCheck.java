package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.BgpPeer;
import com.sparrowlogic.networktopology.model.DxVirtualInterface;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Connection state, then per virtual interface its state and its BGP sessions.
 */
public class DirectConnectHealthCheck implements TopologyCheck {

    private static final Set<String> HEALTHY_CONNECTION_STATES = Set.of("available", "ordering", "requested");

    @Override
    public String name() {
        return "direct-connect";
    }

    @Override
    public List<Finding> run(NetworkCatalog catalog) {
        var findings = new ArrayList<Finding>();

        for (var conn : catalog.getDxConnections().values()) {
            if ("down".equals(conn.state())) {
                findings.add(new Finding(FindingKind.DX_DOWN, Severity.ERROR, conn.displayName(),
                    "Direct Connect connection " + conn.displayName() + " is DOWN at " + conn.location()));
            } else if (!HEALTHY_CONNECTION_STATES.contains(conn.state())) {
                findings.add(new Finding(FindingKind.DX_DEGRADED, Severity.WARNING, conn.displayName(),
                    "Direct Connect connection " + conn.displayName() + " is in state: " + conn.state()));
            }
        }

        for (var vif : catalog.getDxVirtualInterfaces().values()) {
            if (!"available".equals(vif.state())) {
                findings.add(new Finding(FindingKind.VIF_DOWN, Severity.ERROR, vif.displayName(),
                    "VIF " + vif.displayName() + " is in state: " + vif.state()));
            }
            findings.addAll(checkBgp(vif));
        }
        return findings;
    }

    private static List<Finding> checkBgp(DxVirtualInterface vif) {
        var peersDown = vif.bgpPeers().stream().filter(p -> !p.isUp()).toList();
        if (!vif.bgpPeers().isEmpty() && peersDown.size() == vif.bgpPeers().size()) {
            return List.of(new Finding(FindingKind.BGP_DOWN, Severity.ERROR, vif.displayName(),
                "All BGP peers DOWN for VIF " + vif.displayName()));
        }
        var findings = new ArrayList<Finding>();
        for (BgpPeer peer : peersDown) {
            findings.add(new Finding(FindingKind.BGP_PARTIAL, Severity.WARNING, vif.displayName(),
                "BGP peer ASN " + peer.asn() + " (" + peer.customerAddress() + ") DOWN on " + vif.displayName()));
        }
        return findings;
    }
}
