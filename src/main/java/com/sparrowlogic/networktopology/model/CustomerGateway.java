package com.sparrowlogic.networktopology.model;

public record CustomerGateway(String id, String name, String ipAddress, String bgpAsn, String state, String deviceName) {
}
