package com.sparrowlogic.networktopology.model;

public record NatGateway(String id, String vpcId, String subnetId, String state, String name) {
}
