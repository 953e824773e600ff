package com.sparrowlogic.networktopology.model;

public record VpcPeering(
    String id,
    String name,
    String status,
    String requesterVpcId,
    String requesterCidr,
    String accepterVpcId,
    String accepterCidr
) {

    public String displayName() {
        return name.isBlank() ? id : name;
    }

    public boolean isActive() {
        return "active".equals(status);
    }
}
