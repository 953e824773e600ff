package com.sparrowlogic.networktopology.service;

import com.sparrowlogic.networktopology.analysis.ConnectivityAnalyzer;
import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.config.TopologyProperties;
import com.sparrowlogic.networktopology.ingest.RawSnapshot;
import com.sparrowlogic.networktopology.ingest.SnapshotLoadException;
import com.sparrowlogic.networktopology.ingest.SnapshotLoader;
import com.sparrowlogic.networktopology.model.Severity;
import com.sparrowlogic.networktopology.topology.Correlator;
import com.sparrowlogic.networktopology.topology.SubnetClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs the load, correlate, classify, analyze pipeline. Every call builds a fresh catalog.
 */
@Service
public class TopologyService {

    private static final Logger log = LoggerFactory.getLogger(TopologyService.class);

    private final SnapshotLoader snapshotLoader;
    private final TopologyProperties properties;
    private final ConnectivityAnalyzer analyzer;

    public TopologyService(SnapshotLoader snapshotLoader, TopologyProperties properties) {
        this.snapshotLoader = snapshotLoader;
        this.properties = properties;
        this.analyzer = ConnectivityAnalyzer.withDefaultChecksExcept(properties.analysis().disabledChecks());
    }

    /**
     * Analyses the snapshot in {@code dataDir}, or in the configured directory when it is blank.
     * A requested directory is resolved against the snapshot root and may not leave it.
     */
    public AnalysisResult analyze(String dataDir) {
        var directory = dataDir == null || dataDir.isBlank() ? Path.of(properties.dataDir()) : resolveRequested(dataDir.trim());
        var snapshot = snapshotLoader.load(directory, properties.accountId());
        return analyze(snapshot);
    }

    public AnalysisResult analyze(RawSnapshot snapshot) {
        var catalog = new NetworkCatalog(snapshot.accountId());
        new Correlator(catalog).correlate(snapshot);
        new SubnetClassifier().classify(catalog);
        var findings = analyzer.findIssues(catalog);

        var result = new AnalysisResult(catalog, findings);
        log.info("{} account: {} TGW(s), {} attachment(s), {} VPC(s); {} error(s), {} warning(s), {} info",
            catalog.isHub() ? "Hub" : catalog.isSpoke() ? "Spoke" : "Standalone",
            catalog.getTransitGateways().size(), catalog.getTgwAttachments().size(), catalog.getVpcs().size(),
            result.count(Severity.ERROR), result.count(Severity.WARNING), result.count(Severity.INFO));
        return result;
    }

    private Path resolveRequested(String dataDir) {
        var root = Path.of(properties.snapshotRoot()).toAbsolutePath().normalize();
        var directory = root.resolve(dataDir).normalize();
        if (!directory.startsWith(root)) {
            log.warn("Rejected snapshot directory {} outside {}", dataDir, root);
            throw new SnapshotLoadException("Snapshot directory is outside " + root + ": " + dataDir);
        }
        return directory;
    }
}
