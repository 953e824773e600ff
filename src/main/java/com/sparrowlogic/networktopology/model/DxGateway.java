package com.sparrowlogic.networktopology.model;

public record DxGateway(String id, String name, long amazonAsn, String ownerAccount, String state) {
}
