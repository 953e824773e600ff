package com.sparrowlogic.networktopology.model;

/**
 * A BGP session on a Direct Connect virtual interface.
 *
 * @param bgpState provisioning state ({@code available}, {@code pending}, ...)
 * @param bgpStatus session status ({@code up} or {@code down}), compared case-insensitively
 */
public record BgpPeer(
    String peerId,
    long asn,
    String amazonAddress,
    String customerAddress,
    String bgpState,
    String bgpStatus
) {

    public boolean isUp() {
        return "up".equalsIgnoreCase(bgpStatus);
    }
}
