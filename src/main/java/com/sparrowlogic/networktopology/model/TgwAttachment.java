package com.sparrowlogic.networktopology.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An attachment of a VPC, VPN, Direct Connect gateway or peer gateway to a Transit Gateway.
 *
 * <p>{@code crossAccount} is fixed at creation: the underlying resource belongs to an account other
 * than the gateway owner, so the local account cannot describe it. Such attachments only learn their
 * CIDRs from routes the remote side propagated.
 */
public class TgwAttachment {

    private final String id;
    private final String tgwId;
    private final AttachmentType type;
    private final String resourceId;
    private final String resourceOwnerId;
    private final String state;
    private final boolean crossAccount;
    private final String tgwOwnerId;
    private String name;
    private List<String> cidrs = List.of();
    private String associatedRouteTableId;
    private final List<String> propagatingTo = new ArrayList<>();

    public TgwAttachment(String id, String tgwId, AttachmentType type, String resourceId, String resourceOwnerId,
                         String name, String state, boolean crossAccount, String tgwOwnerId) {
        this.id = id;
        this.tgwId = tgwId;
        this.type = type;
        this.resourceId = resourceId;
        this.resourceOwnerId = resourceOwnerId;
        this.name = name;
        this.state = state;
        this.crossAccount = crossAccount;
        this.tgwOwnerId = tgwOwnerId;
    }

    public String getId() {
        return id;
    }

    public String getTgwId() {
        return tgwId;
    }

    public AttachmentType getType() {
        return type;
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getResourceOwnerId() {
        return resourceOwnerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String displayName() {
        if (!name.isBlank()) {
            return name;
        }
        return resourceId.isBlank() ? id : resourceId;
    }

    public String getState() {
        return state;
    }

    public boolean isCrossAccount() {
        return crossAccount;
    }

    public String getTgwOwnerId() {
        return tgwOwnerId;
    }

    public List<String> getCidrs() {
        return cidrs;
    }

    public void setCidrs(List<String> cidrs) {
        this.cidrs = List.copyOf(cidrs);
    }

    public String getAssociatedRouteTableId() {
        return associatedRouteTableId;
    }

    public void setAssociatedRouteTableId(String associatedRouteTableId) {
        this.associatedRouteTableId = associatedRouteTableId;
    }

    public List<String> getPropagatingTo() {
        return Collections.unmodifiableList(propagatingTo);
    }

    public void addPropagatingTo(String routeTableId) {
        if (!propagatingTo.contains(routeTableId)) {
            propagatingTo.add(routeTableId);
        }
    }
}
