package com.sparrowlogic.networktopology.model;

import java.util.Objects;

/**
 * A single defect reported by a topology check.
 *
 * @param kind what was detected
 * @param severity how serious it is
 * @param location human label of the resource (or resource pair) involved
 * @param message human readable description
 */
public record Finding(
    FindingKind kind,
    Severity severity,
    String location,
    String message
) {
    public Finding {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
    }
}
