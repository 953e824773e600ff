package com.sparrowlogic.networktopology.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingKind {
    BLACKHOLE("blackhole"),
    ASYMMETRIC("asymmetric"),
    PEERING("peering"),
    OVERLAP("overlap"),
    MISSING_ROUTE("missing_route"),
    VPN_DOWN("vpn_down"),
    VPN_PARTIAL("vpn_partial"),
    DX_DOWN("dx_down"),
    DX_DEGRADED("dx_degraded"),
    VIF_DOWN("vif_down"),
    BGP_DOWN("bgp_down"),
    BGP_PARTIAL("bgp_partial");

    private final String code;

    FindingKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
