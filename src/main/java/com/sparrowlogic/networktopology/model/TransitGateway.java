package com.sparrowlogic.networktopology.model;

public record TransitGateway(String id, String name, String ownerId, long asn, String state) {

    public String displayName() {
        return name.isBlank() ? id : name;
    }
}
