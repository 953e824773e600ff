package com.sparrowlogic.networktopology.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.Set;

/**
 * Settings bound from the {@code topology.*} properties.
 *
 * @param dataDir snapshot directory analysed when a request does not name one
 * @param snapshotRoot directory that requested snapshot directories are resolved against and confined to
 * @param accountId local account id, used when the snapshot's {@code metadata.json} has none
 * @param diagram diagram rendering settings
 * @param analysis analyzer settings
 */
@ConfigurationProperties("topology")
public record TopologyProperties(
    @DefaultValue("./aws-data") String dataDir,
    @DefaultValue(".") String snapshotRoot,
    @DefaultValue("") String accountId,
    @DefaultValue Diagram diagram,
    @DefaultValue Analysis analysis
) {

    /**
     * @param maxRoutesPerTable routes listed inside a route table node before it is summarised
     */
    public record Diagram(@DefaultValue("5") int maxRoutesPerTable) {}

    /**
     * @param disabledChecks names of checks to skip
     */
    public record Analysis(@DefaultValue Set<String> disabledChecks) {

        public Analysis {
            disabledChecks = disabledChecks != null ? Set.copyOf(disabledChecks) : Set.of();
        }
    }

    public static TopologyProperties defaults() {
        return new TopologyProperties("./aws-data", ".", "", new Diagram(5), new Analysis(Set.of()));
    }
}
