package com.sparrowlogic.networktopology.model;

public record VpnTunnel(
    String outsideIp,
    String status,
    String statusMessage,
    int acceptedRouteCount,
    String lastStatusChange
) {

    public boolean isUp() {
        return "UP".equals(status);
    }
}
