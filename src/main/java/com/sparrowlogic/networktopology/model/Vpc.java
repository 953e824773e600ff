package com.sparrowlogic.networktopology.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Vpc {

    private final String id;
    private final String name;
    private final List<String> cidrs;
    private final String ownerId;
    private final boolean defaultVpc;
    private String igwId;
    private final List<String> natGatewayIds = new ArrayList<>();
    private String tgwAttachmentId;
    private String mainRouteTableId;

    public Vpc(String id, String name, List<String> cidrs, String ownerId, boolean defaultVpc) {
        this.id = id;
        this.name = name;
        this.cidrs = List.copyOf(cidrs);
        this.ownerId = ownerId;
        this.defaultVpc = defaultVpc;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String displayName() {
        return name.isBlank() ? id : name;
    }

    /**
     * Primary CIDR first, then secondary associations, without duplicates.
     */
    public List<String> getCidrs() {
        return cidrs;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public boolean isDefaultVpc() {
        return defaultVpc;
    }

    public String getIgwId() {
        return igwId;
    }

    public void setIgwId(String igwId) {
        this.igwId = igwId;
    }

    public List<String> getNatGatewayIds() {
        return Collections.unmodifiableList(natGatewayIds);
    }

    public void addNatGatewayId(String natGatewayId) {
        natGatewayIds.add(natGatewayId);
    }

    public String getTgwAttachmentId() {
        return tgwAttachmentId;
    }

    public void setTgwAttachmentId(String tgwAttachmentId) {
        this.tgwAttachmentId = tgwAttachmentId;
    }

    public String getMainRouteTableId() {
        return mainRouteTableId;
    }

    public void setMainRouteTableId(String mainRouteTableId) {
        this.mainRouteTableId = mainRouteTableId;
    }
}
