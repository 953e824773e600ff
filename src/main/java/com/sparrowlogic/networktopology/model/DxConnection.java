package com.sparrowlogic.networktopology.model;

public record DxConnection(
    String id,
    String name,
    String state,
    String location,
    String bandwidth,
    int vlan,
    String partnerName,
    String providerName,
    boolean logicalRedundancy,
    String awsDevice
) {

    public String displayName() {
        return name.isBlank() ? id : name;
    }
}
