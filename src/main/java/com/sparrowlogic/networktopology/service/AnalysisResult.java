package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import com.sparrowlogic.networktopology.model.Severity;

import java.util.List;

/**
 * Outcome of one pipeline run: the completed catalog and everything the checks reported.
 */
public record AnalysisResult(NetworkCatalog catalog, List<Finding> findings) {

    public AnalysisResult {
        findings = List.copyOf(findings);
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).count();
    }
}
