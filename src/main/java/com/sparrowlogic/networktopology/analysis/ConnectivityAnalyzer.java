package com.sparrowlogic.networktopology.analysis;

import com.sparrowlogic.networktopology.catalog.NetworkCatalog;
import com.sparrowlogic.networktopology.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Runs the topology checks in a fixed order and concatenates their findings. Each check's findings
 * form one contiguous block in that order.
 */
public class ConnectivityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConnectivityAnalyzer.class);

    private final List<TopologyCheck> checks;

    public ConnectivityAnalyzer(List<TopologyCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public static List<TopologyCheck> defaultChecks() {
        return List.of(
            new BlackholeRouteCheck(),
            new AsymmetricReachabilityCheck(),
            new PeeringStatusCheck(),
            new CidrOverlapCheck(),
            new MissingTgwRouteCheck(),
            new VpnTunnelHealthCheck(),
            new DirectConnectHealthCheck()
        );
    }

    public static ConnectivityAnalyzer withDefaultChecks() {
        return new ConnectivityAnalyzer(defaultChecks());
    }

    /**
     * The default checks minus the ones named in {@code disabled}. Unknown names are ignored.
     */
    public static ConnectivityAnalyzer withDefaultChecksExcept(Collection<String> disabled) {
        var skip = Set.copyOf(disabled);
        return new ConnectivityAnalyzer(defaultChecks().stream().filter(c -> !skip.contains(c.name())).toList());
    }

    public List<TopologyCheck> getChecks() {
        return checks;
    }

    public List<Finding> findIssues(NetworkCatalog catalog) {
        var findings = new ArrayList<Finding>();
        for (var check : checks) {
            var result = check.run(catalog);
            log.debug("Check {} reported {} finding(s)", check.name(), result.size());
            findings.addAll(result);
        }
        return findings;
    }
}
