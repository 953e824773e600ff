package com.sparrowlogic.networktopology.model;

public enum RouteOrigin {
    STATIC,
    PROPAGATED;

    public static RouteOrigin fromValue(String value) {
        return "propagated".equals(value) ? PROPAGATED : STATIC;
    }
}
