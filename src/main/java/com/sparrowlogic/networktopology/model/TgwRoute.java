package com.sparrowlogic.networktopology.model;

/**
 * A route in a Transit Gateway route table. Exactly one of {@code destinationCidr} and
 * {@code prefixListId} is normally set; the prefix list wins for display.
 */
public record TgwRoute(
    String destinationCidr,
    String prefixListId,
    String attachmentId,
    String resourceId,
    String resourceType,
    RouteOrigin origin,
    RouteState state
) {

    public String destination() {
        if (prefixListId != null && !prefixListId.isEmpty()) {
            return prefixListId;
        }
        return destinationCidr != null ? destinationCidr : "";
    }

    public boolean isBlackhole() {
        return state == RouteState.BLACKHOLE;
    }

    public boolean isPropagated() {
        return origin == RouteOrigin.PROPAGATED;
    }
}
