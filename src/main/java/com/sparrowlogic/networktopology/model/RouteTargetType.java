package com.sparrowlogic.networktopology.model;

public enum RouteTargetType {
    LOCAL("local"),
    IGW("igw"),
    NAT("nat"),
    TGW("tgw"),
    VPC_PEERING("pcx"),
    VPC_ENDPOINT("vpce"),
    VGW("vgw"),
    ENI("eni"),
    EGRESS_IGW("eigw"),
    UNKNOWN("unknown");

    private final String label;

    RouteTargetType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
