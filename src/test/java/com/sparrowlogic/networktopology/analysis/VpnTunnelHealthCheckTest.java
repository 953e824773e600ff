package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.FindingKind;
import com.sparrowlogic.networktopology.model.Severity;
import com.sparrowlogic.networktopology.model.VpnConnection;
import com.sparrowlogic.networktopology.model.VpnTunnel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VpnTunnelHealthCheckTest {

    private final VpnTunnelHealthCheck check = new VpnTunnelHealthCheck();

    private static NetworkCatalog catalogWith(VpnTunnel... tunnels) {
        var catalog = new NetworkCatalog("111111111111");
        var vpn = new VpnConnection("vpn-1", "branch", "available", "cgw-1", "tgw-1", null, List.of(tunnels),
            false, false, "0.0.0.0/0", "0.0.0.0/0", List.of());
        catalog.getVpnConnections().put(vpn.id(), vpn);
        return catalog;
    }

    private static VpnTunnel tunnel(String ip, String status, String message) {
        return new VpnTunnel(ip, status, message, 0, "");
    }

    @Test
    void shouldReportNothingWhenAllTunnelsUp() {
        var catalog = catalogWith(tunnel("1.1.1.1", "UP", ""), tunnel("2.2.2.2", "UP", ""));

        assertTrue(check.run(catalog).isEmpty());
    }

    @Test
    void shouldWarnPerDownTunnel() {
        var catalog = catalogWith(tunnel("1.1.1.1", "UP", ""), tunnel("2.2.2.2", "DOWN", "IPSEC IS DOWN"));

        var findings = check.run(catalog);

        assertEquals(1, findings.size());
        assertEquals(FindingKind.VPN_PARTIAL, findings.get(0).kind());
        assertEquals(Severity.WARNING, findings.get(0).severity());
        assertTrue(findings.get(0).message().contains("2.2.2.2"));
        assertEquals("Tunnel 2.2.2.2 DOWN for branch: IPSEC IS DOWN", findings.get(0).message());
    }

    @Test
    void shouldUsePlaceholderForEmptyStatusMessage() {
        var catalog = catalogWith(tunnel("1.1.1.1", "UP", ""), tunnel("2.2.2.2", "DOWN", ""));

        assertEquals("Tunnel 2.2.2.2 DOWN for branch: No message", check.run(catalog).get(0).message());
    }

    @Test
    void shouldReportSingleErrorWhenAllTunnelsDown() {
        var catalog = catalogWith(tunnel("1.1.1.1", "DOWN", ""), tunnel("2.2.2.2", "DOWN", ""));

        var findings = check.run(catalog);

        assertEquals(1, findings.size());
        assertEquals(FindingKind.VPN_DOWN, findings.get(0).kind());
        assertEquals(Severity.ERROR, findings.get(0).severity());
        assertEquals("All tunnels DOWN for VPN branch", findings.get(0).message());
    }

    @Test
    void shouldIgnoreConnectionWithoutTelemetry() {
        assertTrue(check.run(catalogWith()).isEmpty());
    }
}
