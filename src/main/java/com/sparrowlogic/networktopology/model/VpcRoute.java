package com.sparrowlogic.networktopology.model;

public record VpcRoute(String destination, RouteTargetType targetType, String targetId, RouteState state) {

    public boolean isBlackhole() {
        return state == RouteState.BLACKHOLE;
    }

    public boolean isDefaultRoute() {
        return "0.0.0.0/0".equals(destination) || "::/0".equals(destination);
    }
}
