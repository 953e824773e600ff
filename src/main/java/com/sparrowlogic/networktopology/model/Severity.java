package com.sparrowlogic.networktopology.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
