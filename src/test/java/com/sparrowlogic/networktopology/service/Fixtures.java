package com.sparrowlogic.networktopology.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparrowlogic.networktopology.config.TopologyProperties;
import com.sparrowlogic.networktopology.ingest.SnapshotLoader;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Set;

final class Fixtures {

    private Fixtures() {
    }

    static String snapshotRoot() {
        try {
            return Path.of(Fixtures.class.getResource("/snapshots").toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    static String snapshotDir(String name) {
        return Path.of(snapshotRoot(), name).toString();
    }

    /**
     * Properties confining requested directories to the test snapshots.
     */
    static TopologyProperties properties(Set<String> disabledChecks) {
        return new TopologyProperties("./aws-data", snapshotRoot(), "", new TopologyProperties.Diagram(5),
            new TopologyProperties.Analysis(disabledChecks));
    }

    static TopologyService service() {
        return new TopologyService(new SnapshotLoader(new ObjectMapper()), properties(Set.of()));
    }

    static AnalysisResult analyze(String name) {
        return service().analyze(name);
    }
}
