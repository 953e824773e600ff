package com.sparrowlogic.networktopology.model;

public enum RouteState {
    ACTIVE,
    BLACKHOLE;

    /**
     * Anything other than {@code blackhole} (including a missing state) is treated as active.
     */
    public static RouteState fromValue(String value) {
        return "blackhole".equals(value) ? BLACKHOLE : ACTIVE;
    }
}
