package com.sparrowlogic.networktopology.model;

/**
 * Internet reachability of a subnet, derived from the default route of its effective route table.
 */
public enum SubnetClass {
    PUBLIC("public"),
    PRIVATE("private"),
    ISOLATED("isolated"),
    TGW_ATTACHED("tgw");

    private final String label;

    SubnetClass(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
