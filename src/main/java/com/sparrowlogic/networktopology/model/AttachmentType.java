package com.sparrowlogic.networktopology.model;

public enum AttachmentType {
    VPC("vpc"),
    VPN("vpn"),
    DIRECT_CONNECT_GATEWAY("direct-connect-gateway"),
    PEERING("peering"),
    TGW_PEERING("tgw-peering"),
    CONNECT("connect"),
    UNKNOWN("unknown");

    private final String value;

    AttachmentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static AttachmentType fromValue(String value) {
        for (var type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
